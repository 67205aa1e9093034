package com.wellbeingplatform.analysis.config;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.analysis.registry.AlgorithmCatalog;
import com.wellbeingplatform.analysis.registry.AlgorithmRegistry;
import com.wellbeingplatform.common.integration.WeightTable;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Builds one {@link AlgorithmRegistry} per family from every {@link AlgorithmUnit} bean.
 */
@Configuration
public class AnalysisEngineConfig {

    @Value("${analysis.orchestrator.realtime-budget-ms:250}")
    private long realtimeBudgetMs;

    @Bean
    public AlgorithmRegistry emotionalRegistry(List<AlgorithmUnit> units) {
        return registry(AlgorithmFamily.EMOTIONAL, units);
    }

    @Bean
    public AlgorithmRegistry neuroplasticityRegistry(List<AlgorithmUnit> units) {
        return registry(AlgorithmFamily.NEUROPLASTICITY, units);
    }

    private AlgorithmRegistry registry(AlgorithmFamily family, List<AlgorithmUnit> units) {
        List<AlgorithmUnit> familyUnits = units.stream().filter(u -> u.family() == family).toList();
        WeightTable weights = WeightTable.of(family.name().toLowerCase(), AlgorithmCatalog.defaultWeights(family));
        return new AlgorithmRegistry(family, familyUnits, weights,
            AlgorithmCatalog.realtimeSubset(family), Duration.ofMillis(realtimeBudgetMs));
    }
}
