package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Everything an Algorithm Unit may read for one pass: the events in scope (a rolling
 * window for real-time passes, the tick window for periodic passes, none for the final
 * pass), the collector summary when one exists, and numeric metrics derived from both.
 */
public record SessionData(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("userId") String userId,
    @JsonProperty("activityType") String activityType,
    @JsonProperty("difficulty") String difficulty,
    @JsonProperty("events") List<InteractionEvent> events,
    @JsonProperty("summary") CollectorSummary summary,
    @JsonProperty("metrics") Map<String, Double> metrics
) {
    public SessionData {
        events  = events == null ? List.of() : List.copyOf(events);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public OptionalDouble metric(String name) {
        Double v = metrics.get(name);
        return v == null || !Double.isFinite(v) ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public double metricOr(String name, double fallback) {
        return metric(name).orElse(fallback);
    }

    public boolean hasMetric(String name) {
        return metric(name).isPresent();
    }

    @JsonIgnore
    public Optional<InteractionEvent> latestEvent() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    /**
     * Explicit reading of {@code field} on the most recent event, if the event carried one.
     * Real-time units prefer this over their derived heuristics.
     */
    public OptionalDouble latestReading(String field) {
        return latestEvent().map(e -> e.number(field)).orElse(OptionalDouble.empty());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return events.isEmpty() && (summary == null || summary.totalEvents() == 0);
    }
}
