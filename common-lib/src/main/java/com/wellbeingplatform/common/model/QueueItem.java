package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An intervention or optimization awaiting the surrounding application.
 *
 * <p>The id is derived from the triggering analysis and the kind, so the same trigger
 * always yields the same id. {@code processed} moves only from {@code false} to
 * {@code true}.
 */
public record QueueItem(
    @JsonProperty("id") String id,
    @JsonProperty("kind") QueueKind kind,
    @JsonProperty("priority") QueuePriority priority,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("action") String action,
    @JsonProperty("reason") String reason,
    @JsonProperty("trigger") IntegratedAnalysis trigger,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("processed") boolean processed,
    @JsonProperty("processedAt") Instant processedAt
) {
    public static QueueItem create(QueueKind kind, QueuePriority priority, String sessionId,
                                   String action, String reason, IntegratedAnalysis trigger) {
        return new QueueItem(idFor(kind, trigger), kind, priority, sessionId, action, reason,
            trigger, Instant.now(), false, null);
    }

    public static String idFor(QueueKind kind, IntegratedAnalysis trigger) {
        return kind.idPrefix() + "-" + trigger.analysisId();
    }

    public QueueItem markProcessed(Instant at) {
        if (processed) return this;
        return new QueueItem(id, kind, priority, sessionId, action, reason, trigger, createdAt, true, at);
    }
}
