package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Insight(
    @JsonProperty("type") String type,
    @JsonProperty("message") String message,
    @JsonProperty("confidence") double confidence
) {
    public static Insight of(String type, String message, double confidence) {
        return new Insight(type, message, Math.max(0.0, Math.min(1.0, confidence)));
    }
}
