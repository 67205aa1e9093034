package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Weighted combination of a set of {@link AlgorithmResult}s. Recomputed from scratch on
 * every processing pass; the {@code with*} methods return enriched copies and never
 * mutate the receiver.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code overallScore}, {@code confidenceScore} — weighted averages over present units</li>
 *   <li>{@code riskScore}, {@code opportunityScore} — composites of the risk/opportunity signals</li>
 *   <li>{@code algorithmScores} — per-unit scores, declaration order</li>
 *   <li>{@code familyScores} — per-family overall score, when the pass covered both families</li>
 *   <li>{@code unavailableAlgorithms} — units expected by the weight table that produced nothing</li>
 * </ul>
 */
public record IntegratedAnalysis(
    @JsonProperty("analysisId") String analysisId,
    @JsonProperty("mode") AnalysisMode mode,
    @JsonProperty("overallScore") double overallScore,
    @JsonProperty("confidenceScore") double confidenceScore,
    @JsonProperty("riskScore") double riskScore,
    @JsonProperty("opportunityScore") double opportunityScore,
    @JsonProperty("insights") List<Insight> insights,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("algorithmScores") Map<String, Double> algorithmScores,
    @JsonProperty("signals") Map<String, Double> signals,
    @JsonProperty("familyScores") Map<AlgorithmFamily, Double> familyScores,
    @JsonProperty("unavailableAlgorithms") List<String> unavailableAlgorithms,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static final String NO_DATA          = "NO_DATA";
    public static final String TOTAL_FAILURE    = "INTEGRATION_FAILURE";

    public IntegratedAnalysis {
        insights              = insights == null ? List.of() : List.copyOf(insights);
        recommendations       = recommendations == null ? List.of() : List.copyOf(recommendations);
        algorithmScores       = freeze(algorithmScores);
        signals               = freeze(signals);
        familyScores          = familyScores == null ? Map.of()
                                                     : Collections.unmodifiableMap(new LinkedHashMap<>(familyScores));
        unavailableAlgorithms = unavailableAlgorithms == null ? List.of() : List.copyOf(unavailableAlgorithms);
    }

    /**
     * Analysis for a pass with nothing to analyze: zero scores and one explicit
     * {@value #NO_DATA} insight.
     */
    public static IntegratedAnalysis noData(AnalysisMode mode, String reason) {
        return new IntegratedAnalysis(UUID.randomUUID().toString(), mode, 0.0, 0.0, 0.0, 0.0,
            List.of(Insight.of(NO_DATA, reason, 1.0)), List.of(),
            Map.of(), Map.of(), Map.of(), List.of(), true, Instant.now());
    }

    public IntegratedAnalysis withMode(AnalysisMode newMode) {
        return new IntegratedAnalysis(analysisId, newMode, overallScore, confidenceScore, riskScore,
            opportunityScore, insights, recommendations, algorithmScores, signals, familyScores,
            unavailableAlgorithms, degraded, timestamp);
    }

    public IntegratedAnalysis withFamilyScores(Map<AlgorithmFamily, Double> scores) {
        return new IntegratedAnalysis(analysisId, mode, overallScore, confidenceScore, riskScore,
            opportunityScore, insights, recommendations, algorithmScores, signals, scores,
            unavailableAlgorithms, degraded, timestamp);
    }

    public IntegratedAnalysis withRecommendations(List<Recommendation> extra) {
        List<Recommendation> merged = new ArrayList<>(recommendations);
        merged.addAll(extra);
        return new IntegratedAnalysis(analysisId, mode, overallScore, confidenceScore, riskScore,
            opportunityScore, insights, merged, algorithmScores, signals, familyScores,
            unavailableAlgorithms, degraded, timestamp);
    }

    /**
     * Applies a degradation: scales confidence by {@code confidenceFactor}, appends the
     * given insights and marks the analysis degraded.
     */
    public IntegratedAnalysis degrade(double confidenceFactor, List<Insight> extraInsights) {
        List<Insight> merged = new ArrayList<>(insights);
        merged.addAll(extraInsights);
        double scaled = Math.max(0.0, Math.min(1.0, confidenceScore * confidenceFactor));
        return new IntegratedAnalysis(analysisId, mode, overallScore, scaled, riskScore,
            opportunityScore, merged, recommendations, algorithmScores, signals, familyScores,
            unavailableAlgorithms, true, timestamp);
    }

    public double signal(String name, double fallback) {
        Double v = signals.get(name);
        return v == null ? fallback : v;
    }

    private static <K> Map<K, Double> freeze(Map<K, Double> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
