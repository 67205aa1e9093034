package com.wellbeingplatform.orchestrator.pipeline;

import com.wellbeingplatform.analysis.registry.AlgorithmRegistry;
import com.wellbeingplatform.analysis.registry.RegistryRun;
import com.wellbeingplatform.common.integration.WeightTable;
import com.wellbeingplatform.common.integration.WeightedIntegrator;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.AnalysisMode;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import com.wellbeingplatform.common.trace.TraceContextUtil;
import com.wellbeingplatform.orchestrator.config.OrchestratorSettings;
import com.wellbeingplatform.orchestrator.logger.AnalysisFlowLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs both algorithm families concurrently and integrates their results against the
 * combined weight table (family tables scaled by their configured shares).
 *
 * <p>A family without data contributes no results; its units are reported missing by
 * the integrator. A family whose collector failed is flagged: confidence is halved and a
 * {@value #COLLECTOR_UNAVAILABLE} insight names the family.
 */
@Component
public class DualFamilyAnalyzer {

    public static final String COLLECTOR_UNAVAILABLE = "COLLECTOR_UNAVAILABLE";

    private static final double DEGRADED_CONFIDENCE_FACTOR = 0.5;

    private final AlgorithmRegistry emotional;
    private final AlgorithmRegistry neuroplasticity;
    private final WeightedIntegrator integrator;
    private final AnalysisFlowLogger flowLogger;
    private final WeightTable fullTable;
    private final WeightTable realtimeTable;

    public DualFamilyAnalyzer(@Qualifier("emotionalRegistry") AlgorithmRegistry emotional,
                              @Qualifier("neuroplasticityRegistry") AlgorithmRegistry neuroplasticity,
                              WeightedIntegrator integrator,
                              OrchestratorSettings settings,
                              AnalysisFlowLogger flowLogger) {
        this.emotional       = emotional;
        this.neuroplasticity = neuroplasticity;
        this.integrator      = integrator;
        this.flowLogger      = flowLogger;
        this.fullTable       = combine("combined", false, settings);
        this.realtimeTable   = combine("combined-realtime", true, settings);
    }

    private WeightTable combine(String label, boolean realtime, OrchestratorSettings settings) {
        Map<WeightTable, Double> shares = new LinkedHashMap<>();
        shares.put(emotional.weights(realtime), settings.emotionalShare());
        shares.put(neuroplasticity.weights(realtime), settings.neuroplasticityShare());
        return WeightTable.combine(label, shares);
    }

    public WeightTable weights(AnalysisMode mode) {
        return mode == AnalysisMode.REALTIME ? realtimeTable : fullTable;
    }

    /**
     * @param data     per-family input; a missing entry means the family has nothing to score
     * @param degraded families whose collector failed during this session
     */
    public Mono<IntegratedAnalysis> analyze(String sessionId, UserProfile profile,
                                            Map<AlgorithmFamily, SessionData> data,
                                            AnalysisMode mode, Set<AlgorithmFamily> degraded) {
        boolean realtime = mode == AnalysisMode.REALTIME;
        Mono<IntegratedAnalysis> pipeline = Mono.zip(
                run(emotional, profile, data.get(AlgorithmFamily.EMOTIONAL), realtime),
                run(neuroplasticity, profile, data.get(AlgorithmFamily.NEUROPLASTICITY), realtime))
            .map(runs -> integrate(List.of(runs.getT1(), runs.getT2()), mode, degraded))
            .doOnEach(flowLogger.stage(stageFor(mode)));
        return TraceContextUtil.withSessionId(pipeline, sessionId);
    }

    /** Blocking convenience for callers on their own thread. */
    public IntegratedAnalysis analyzeNow(String sessionId, UserProfile profile,
                                         Map<AlgorithmFamily, SessionData> data,
                                         AnalysisMode mode, Set<AlgorithmFamily> degraded) {
        return analyze(sessionId, profile, data, mode, degraded).block();
    }

    private Mono<RegistryRun> run(AlgorithmRegistry registry, UserProfile profile, SessionData data, boolean realtime) {
        if (data == null) {
            return Mono.just(RegistryRun.empty(registry.family()));
        }
        return registry.dispatchAll(profile, data, realtime);
    }

    private IntegratedAnalysis integrate(List<RegistryRun> runs, AnalysisMode mode, Set<AlgorithmFamily> degraded) {
        boolean realtime = mode == AnalysisMode.REALTIME;
        List<AlgorithmResult> all = new ArrayList<>();
        Map<AlgorithmFamily, Double> familyScores = new EnumMap<>(AlgorithmFamily.class);
        for (RegistryRun run : runs) {
            all.addAll(run.results());
            if (!run.results().isEmpty()) {
                AlgorithmRegistry registry = run.family() == AlgorithmFamily.EMOTIONAL ? emotional : neuroplasticity;
                familyScores.put(run.family(),
                    integrator.integrate(run.results(), registry.weights(realtime)).overallScore());
            }
        }

        IntegratedAnalysis analysis = integrator.integrate(all, weights(mode))
            .withMode(mode)
            .withFamilyScores(familyScores);

        if (degraded != null && !degraded.isEmpty()) {
            List<Insight> notes = new ArrayList<>();
            for (AlgorithmFamily family : degraded) {
                notes.add(Insight.of(COLLECTOR_UNAVAILABLE,
                    family + " collector failed; its data is incomplete", 1.0));
            }
            analysis = analysis.degrade(DEGRADED_CONFIDENCE_FACTOR, notes);
        }
        return analysis;
    }

    private static String stageFor(AnalysisMode mode) {
        return switch (mode) {
            case REALTIME -> AnalysisFlowLogger.REALTIME_ANALYZED;
            case PERIODIC -> AnalysisFlowLogger.TICK_AGGREGATED;
            case FINAL    -> AnalysisFlowLogger.FINAL_PASS_COMPLETED;
        };
    }
}
