package com.wellbeingplatform.common.integration;

import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.Recommendation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default {@link WeightedIntegrator}: weighted averages re-normalised over the units
 * that actually produced a result.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Order results by the weight table's declaration order; results from units the
 *       table does not know are ignored.</li>
 *   <li>{@code overallScore = Σ(score_i × w_i) / Σ(w_i present)}.</li>
 *   <li>{@code confidenceScore = Σ(confidence_i × w_i) / Σ(w_i present) × coverage}, where
 *       {@code coverage = Σ(w_i present)} (the table sums to 1). Missing units therefore
 *       lower confidence without dragging the score down.</li>
 *   <li>Signals emitted by several units are averaged; risk and opportunity are derived
 *       from the merged signals via {@link IndicatorCalculator}.</li>
 *   <li>Each missing unit adds an {@value #UNAVAILABLE} insight.</li>
 * </ol>
 * With no weighted result at all the integrator returns zero scores plus one
 * {@value IntegratedAnalysis#TOTAL_FAILURE} insight.
 *
 * <p>This class is stateless and thread-safe. It does NOT modify {@link AlgorithmResult}s.
 */
public class DefaultWeightedIntegrator implements WeightedIntegrator {

    public static final String UNAVAILABLE = "ALGORITHM_UNAVAILABLE";

    @Override
    public IntegratedAnalysis integrate(List<AlgorithmResult> results, WeightTable weights) {
        Map<String, AlgorithmResult> byName = new LinkedHashMap<>();
        if (results != null) {
            for (AlgorithmResult r : results) {
                if (r != null && weights.contains(r.algorithmName())) {
                    byName.putIfAbsent(r.algorithmName(), r);
                }
            }
        }

        double presentWeight   = 0.0;
        double scoreSum        = 0.0;
        double confidenceSum   = 0.0;
        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();
        Map<String, Double> algorithmScores  = new LinkedHashMap<>();
        Map<String, double[]> signalSums     = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();

        for (String name : weights.names()) {
            AlgorithmResult r = byName.get(name);
            if (r == null) {
                missing.add(name);
                continue;
            }
            double w = weights.weight(name);
            presentWeight += w;
            scoreSum      += r.score() * w;
            confidenceSum += r.confidence() * w;
            algorithmScores.put(name, r.score());
            insights.addAll(r.insights());
            recommendations.addAll(r.recommendations());
            r.signals().forEach((signal, level) -> {
                double[] acc = signalSums.computeIfAbsent(signal, k -> new double[2]);
                acc[0] += level;
                acc[1] += 1;
            });
        }

        if (presentWeight <= 0.0) {
            return totalFailure(missing);
        }

        for (String name : missing) {
            insights.add(Insight.of(UNAVAILABLE, name + " produced no result in this pass", 1.0));
        }

        Map<String, Double> signals = new LinkedHashMap<>();
        signalSums.forEach((signal, acc) -> signals.put(signal, acc[0] / acc[1]));

        double coverage   = Math.min(1.0, presentWeight);
        double overall    = clamp(scoreSum / presentWeight);
        double confidence = clamp(confidenceSum / presentWeight * coverage);

        return new IntegratedAnalysis(UUID.randomUUID().toString(), null,
            overall, confidence,
            IndicatorCalculator.riskScore(signals),
            IndicatorCalculator.opportunityScore(signals),
            insights, recommendations, algorithmScores, signals, Map.of(),
            missing, !missing.isEmpty(), Instant.now());
    }

    private IntegratedAnalysis totalFailure(List<String> missing) {
        return new IntegratedAnalysis(UUID.randomUUID().toString(), null, 0.0, 0.0, 0.0, 0.0,
            List.of(Insight.of(IntegratedAnalysis.TOTAL_FAILURE,
                "No algorithm produced a usable result; analysis unavailable for this pass", 1.0)),
            List.of(), Map.of(), Map.of(), Map.of(), missing, true, Instant.now());
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
