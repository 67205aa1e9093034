package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal (or interim) summary emitted by a Data Collector Adapter: interaction counts,
 * error counts, timing statistics and per-field session means.
 */
public record CollectorSummary(
    @JsonProperty("collectorName") String collectorName,
    @JsonProperty("family") AlgorithmFamily family,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("totalEvents") long totalEvents,
    @JsonProperty("errorCount") long errorCount,
    @JsonProperty("durationMs") long durationMs,
    @JsonProperty("avgIntervalMs") double avgIntervalMs,
    @JsonProperty("counts") Map<String, Long> counts,
    @JsonProperty("metrics") Map<String, Double> metrics
) {
    public CollectorSummary {
        counts  = counts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counts));
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static CollectorSummary empty(String collectorName, AlgorithmFamily family, String sessionId) {
        return new CollectorSummary(collectorName, family, sessionId, 0, 0, 0, 0.0, Map.of(), Map.of());
    }

    public long count(String name) {
        return counts.getOrDefault(name, 0L);
    }
}
