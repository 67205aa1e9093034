package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Session-level indicators derived from the final analysis' family scores.
 */
public record SessionOutcome(
    @JsonProperty("overallWellbeing") double overallWellbeing,
    @JsonProperty("learningEffectiveness") double learningEffectiveness,
    @JsonProperty("emotionalStability") double emotionalStability,
    @JsonProperty("cognitiveGrowth") double cognitiveGrowth,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("insights") List<Insight> insights
) {
    public SessionOutcome {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        insights        = insights == null ? List.of() : List.copyOf(insights);
    }
}
