package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of a finished session, created once by the lifecycle manager.
 */
public record SessionReport(
    @JsonProperty("session") Session session,
    @JsonProperty("finalIntegratedAnalysis") IntegratedAnalysis finalIntegratedAnalysis,
    @JsonProperty("history") List<IntegratedAnalysis> history,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("outcome") SessionOutcome outcome,
    @JsonProperty("trends") Map<String, TrendDirection> trends,
    @JsonProperty("summaries") Map<AlgorithmFamily, CollectorSummary> summaries
) {
    public SessionReport {
        history         = history == null ? List.of() : List.copyOf(history);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        trends          = trends == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(trends));
        summaries       = summaries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
    }
}
