package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellbeingplatform.common.exception.AlgorithmExecutionException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one Algorithm Unit invocation. Immutable once built.
 *
 * <p>{@code score} is wellbeing-oriented (higher is better). {@code signals} carries
 * the named indicator levels the unit measured (e.g. {@code frustrationLevel}); those
 * levels feed the risk and opportunity composites and are not necessarily equal to
 * {@code score}.
 */
public record AlgorithmResult(
    @JsonProperty("algorithmName") String algorithmName,
    @JsonProperty("family") AlgorithmFamily family,
    @JsonProperty("score") double score,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("insights") List<Insight> insights,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("signals") Map<String, Double> signals,
    @JsonProperty("timestamp") Instant timestamp
) {
    public AlgorithmResult {
        insights        = insights == null ? List.of() : List.copyOf(insights);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        signals         = signals == null ? Map.of()
                                          : Collections.unmodifiableMap(new LinkedHashMap<>(signals));
    }

    /**
     * Builds a result, clamping score, confidence and every signal into [0, 1].
     *
     * @throws AlgorithmExecutionException if score, confidence or a signal is NaN or infinite
     */
    public static AlgorithmResult of(String algorithmName, AlgorithmFamily family,
                                     double score, double confidence,
                                     List<Insight> insights,
                                     List<Recommendation> recommendations,
                                     Map<String, Double> signals) {
        requireFinite(algorithmName, "score", score);
        requireFinite(algorithmName, "confidence", confidence);
        Map<String, Double> clampedSignals = new LinkedHashMap<>();
        if (signals != null) {
            signals.forEach((name, level) -> {
                requireFinite(algorithmName, name, level == null ? Double.NaN : level);
                clampedSignals.put(name, clamp(level));
            });
        }
        return new AlgorithmResult(algorithmName, family, clamp(score), clamp(confidence),
            insights, recommendations, clampedSignals, Instant.now());
    }

    private static void requireFinite(String algorithmName, String field, double value) {
        if (!Double.isFinite(value)) {
            throw new AlgorithmExecutionException(algorithmName,
                "Non-finite " + field + " produced: " + value);
        }
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
