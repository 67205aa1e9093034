package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view handed to the presentation layer after each update.
 * {@code realtimeData} is the latest real-time analysis, or {@code null} before the first.
 */
public record OrchestratorSnapshot(
    @JsonProperty("currentSession") Session currentSession,
    @JsonProperty("active") boolean active,
    @JsonProperty("realtimeData") IntegratedAnalysis realtimeData,
    @JsonProperty("trends") Map<String, TrendDirection> trends,
    @JsonProperty("interventionQueue") List<QueueItem> interventionQueue,
    @JsonProperty("optimizationQueue") List<QueueItem> optimizationQueue,
    @JsonProperty("timestamp") Instant timestamp
) {
    public OrchestratorSnapshot {
        trends            = trends == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(trends));
        interventionQueue = interventionQueue == null ? List.of() : List.copyOf(interventionQueue);
        optimizationQueue = optimizationQueue == null ? List.of() : List.copyOf(optimizationQueue);
    }
}
