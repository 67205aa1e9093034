package com.wellbeingplatform.analysis.algorithm.neuroplasticity;

import com.wellbeingplatform.common.integration.IndicatorCalculator;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CognitiveImprovementTrackerTest {

    private final CognitiveImprovementTracker unit = new CognitiveImprovementTracker();

    private AlgorithmResult run(UserProfile profile, Map<String, Double> metrics) {
        return unit.execute(profile, new SessionData("s", "u", "math", "medium", List.of(), null, metrics));
    }

    @Test
    @DisplayName("performance at baseline scores 0.5")
    void atBaseline() {
        AlgorithmResult r = run(UserProfile.of("u"), Map.of("performance", 0.5));
        assertEquals(0.5, r.score(), 1e-9);
    }

    @Test
    @DisplayName("performance 30% above baseline raises an improvement insight")
    void aboveBaseline() {
        AlgorithmResult r = run(UserProfile.of("u", Map.of("baselinePerformance", 0.5)), Map.of("performance", 0.65));
        assertEquals(0.65, r.score(), 1e-9);
        assertEquals("improvement", r.insights().get(0).type());
    }

    @Test
    @DisplayName("cognitive overload is emitted only with load evidence")
    void overloadEvidence() {
        assertFalse(run(UserProfile.of("u"), Map.of("performance", 0.5))
            .signals().containsKey(IndicatorCalculator.COGNITIVE_OVERLOAD));

        AlgorithmResult loaded = run(UserProfile.of("u"), Map.of("performance", 0.5, "cognitiveLoad", 0.9));
        assertEquals(0.9, loaded.signals().get(IndicatorCalculator.COGNITIVE_OVERLOAD), 1e-9);
        assertTrue(loaded.recommendations().stream().anyMatch(rec -> rec.action().equals("reduce_load")));
    }

    @Test
    @DisplayName("a rising performance trend raises improvement potential")
    void trendRaisesPotential() {
        double flat = run(UserProfile.of("u"), Map.of("performance", 0.5, "performanceTrend", 0.0))
            .signals().get(IndicatorCalculator.IMPROVEMENT_POTENTIAL);
        double rising = run(UserProfile.of("u"), Map.of("performance", 0.5, "performanceTrend", 0.2))
            .signals().get(IndicatorCalculator.IMPROVEMENT_POTENTIAL);
        assertTrue(rising > flat);
    }
}
