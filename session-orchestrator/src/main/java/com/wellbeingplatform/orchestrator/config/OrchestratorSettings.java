package com.wellbeingplatform.orchestrator.config;

import java.time.Duration;

/**
 * Tunables of the orchestration paths, resolved once from properties by
 * {@link OrchestratorConfig}.
 */
public record OrchestratorSettings(
    long defaultIntervalMs,
    long realtimeBudgetMs,
    int historyLimit,
    double riskThreshold,
    double acuteSignalThreshold,
    double opportunityThreshold,
    double trendTolerance,
    double emotionalShare,
    double neuroplasticityShare
) {
    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(5000, 250, 500, 0.7, 0.8, 0.7, 0.05, 0.6, 0.4);
    }

    /** Session interval when positive, otherwise the configured default. */
    public long intervalFor(long requestedMs) {
        return requestedMs > 0 ? requestedMs : defaultIntervalMs;
    }

    /** How long ending a session waits for admitted real-time passes to commit. */
    public Duration realtimeDrainTimeout() {
        return Duration.ofMillis(Math.max(1, realtimeBudgetMs) * 4);
    }
}
