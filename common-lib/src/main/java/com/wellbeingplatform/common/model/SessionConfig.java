package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-supplied configuration for one session.
 * {@code analysisIntervalMs <= 0} means "use the orchestrator default".
 */
public record SessionConfig(
    @JsonProperty("userId") String userId,
    @JsonProperty("activityType") String activityType,
    @JsonProperty("difficulty") String difficulty,
    @JsonProperty("analysisIntervalMs") long analysisIntervalMs,
    @JsonProperty("realtimeEnabled") boolean realtimeEnabled
) {
    public static SessionConfig of(String userId, String activityType, String difficulty,
                                   long analysisIntervalMs, boolean realtimeEnabled) {
        return new SessionConfig(userId, activityType, difficulty, analysisIntervalMs, realtimeEnabled);
    }
}
