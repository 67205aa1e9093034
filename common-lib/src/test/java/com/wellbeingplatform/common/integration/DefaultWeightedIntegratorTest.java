package com.wellbeingplatform.common.integration;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.Recommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies weighted aggregation, renormalisation over missing units and the
 * total-failure path of {@link DefaultWeightedIntegrator}.
 */
class DefaultWeightedIntegratorTest {

    private final WeightedIntegrator integrator = new DefaultWeightedIntegrator();

    private static WeightTable table() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("A", 0.5);
        w.put("B", 0.3);
        w.put("C", 0.2);
        return WeightTable.of("test", w);
    }

    private static AlgorithmResult result(String name, double score, double confidence) {
        return AlgorithmResult.of(name, AlgorithmFamily.EMOTIONAL, score, confidence,
            List.of(Insight.of("info", name + " insight", confidence)), List.of(), Map.of());
    }

    @Nested
    @DisplayName("all units present")
    class AllPresent {

        @Test
        @DisplayName("overall score is the weighted mean")
        void weightedMean() {
            IntegratedAnalysis a = integrator.integrate(List.of(
                result("A", 1.0, 1.0), result("B", 0.5, 1.0), result("C", 0.0, 1.0)), table());

            assertEquals(0.5 + 0.15, a.overallScore(), 1e-9);
            assertEquals(1.0, a.confidenceScore(), 1e-9);
            assertFalse(a.degraded());
            assertTrue(a.unavailableAlgorithms().isEmpty());
        }

        @Test
        @DisplayName("insights follow table order regardless of result order")
        void declarationOrder() {
            IntegratedAnalysis a = integrator.integrate(List.of(
                result("C", 0.5, 0.5), result("A", 0.5, 0.5), result("B", 0.5, 0.5)), table());

            assertEquals(List.of("A", "B", "C"), List.copyOf(a.algorithmScores().keySet()));
            assertEquals("A insight", a.insights().get(0).message());
        }

        @Test
        @DisplayName("results from unknown units are ignored")
        void unknownIgnored() {
            IntegratedAnalysis a = integrator.integrate(List.of(
                result("A", 1.0, 1.0), result("B", 1.0, 1.0), result("C", 1.0, 1.0),
                result("Rogue", 0.0, 0.0)), table());

            assertEquals(1.0, a.overallScore(), 1e-9);
            assertFalse(a.algorithmScores().containsKey("Rogue"));
        }

        @Test
        @DisplayName("recommendations are concatenated")
        void recommendationsConcatenated() {
            AlgorithmResult withRec = AlgorithmResult.of("A", AlgorithmFamily.EMOTIONAL, 0.4, 0.8,
                List.of(), List.of(Recommendation.of("support", "offer_hint", "hint")), Map.of());
            IntegratedAnalysis a = integrator.integrate(List.of(
                withRec, result("B", 0.5, 0.5), result("C", 0.5, 0.5)), table());

            assertEquals(1, a.recommendations().size());
            assertEquals("offer_hint", a.recommendations().get(0).action());
        }
    }

    @Nested
    @DisplayName("missing units")
    class Missing {

        @Test
        @DisplayName("score renormalises over present units")
        void renormalisesScore() {
            IntegratedAnalysis a = integrator.integrate(List.of(
                result("A", 0.8, 1.0), result("B", 0.4, 1.0)), table());

            double expected = (0.8 * 0.5 + 0.4 * 0.3) / 0.8;
            assertEquals(expected, a.overallScore(), 1e-9);
        }

        @Test
        @DisplayName("confidence is scaled by coverage")
        void confidenceScaledByCoverage() {
            IntegratedAnalysis a = integrator.integrate(List.of(
                result("A", 0.8, 1.0), result("B", 0.4, 1.0)), table());

            assertEquals(0.8, a.confidenceScore(), 1e-9);
        }

        @Test
        @DisplayName("each missing unit is reported")
        void missingReported() {
            IntegratedAnalysis a = integrator.integrate(List.of(result("A", 0.5, 0.5)), table());

            assertTrue(a.degraded());
            assertEquals(List.of("B", "C"), a.unavailableAlgorithms());
            long unavailable = a.insights().stream()
                .filter(i -> DefaultWeightedIntegrator.UNAVAILABLE.equals(i.type())).count();
            assertEquals(2, unavailable);
        }

        @Test
        @DisplayName("no result at all yields a total-failure analysis")
        void totalFailure() {
            IntegratedAnalysis a = integrator.integrate(List.of(), table());

            assertEquals(0.0, a.overallScore());
            assertEquals(0.0, a.confidenceScore());
            assertEquals(IntegratedAnalysis.TOTAL_FAILURE, a.insights().get(0).type());
            assertTrue(a.degraded());
        }

        @Test
        @DisplayName("null result list is treated as empty")
        void nullResults() {
            IntegratedAnalysis a = integrator.integrate(null, table());
            assertEquals(IntegratedAnalysis.TOTAL_FAILURE, a.insights().get(0).type());
        }
    }

    @Nested
    @DisplayName("signals")
    class Signals {

        @Test
        @DisplayName("risk is derived from merged signals")
        void riskFromSignals() {
            AlgorithmResult frustrated = AlgorithmResult.of("A", AlgorithmFamily.EMOTIONAL, 0.1, 0.9,
                List.of(), List.of(), Map.of(IndicatorCalculator.FRUSTRATION, 0.9));
            IntegratedAnalysis a = integrator.integrate(List.of(frustrated), table());

            assertEquals(0.9, a.signal(IndicatorCalculator.FRUSTRATION, 0.0), 1e-9);
            assertEquals(0.9, a.riskScore(), 1e-9);
            assertEquals(0.0, a.opportunityScore());
        }

        @Test
        @DisplayName("a signal emitted by two units is averaged")
        void sharedSignalAveraged() {
            AlgorithmResult a1 = AlgorithmResult.of("A", AlgorithmFamily.EMOTIONAL, 0.5, 0.5,
                List.of(), List.of(), Map.of(IndicatorCalculator.ENGAGEMENT, 0.2));
            AlgorithmResult b1 = AlgorithmResult.of("B", AlgorithmFamily.EMOTIONAL, 0.5, 0.5,
                List.of(), List.of(), Map.of(IndicatorCalculator.ENGAGEMENT, 0.6));
            IntegratedAnalysis a = integrator.integrate(List.of(a1, b1), table());

            assertEquals(0.4, a.signal(IndicatorCalculator.ENGAGEMENT, 0.0), 1e-9);
        }
    }
}
