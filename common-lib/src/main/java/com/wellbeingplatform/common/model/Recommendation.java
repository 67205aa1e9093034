package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Recommendation(
    @JsonProperty("type") String type,
    @JsonProperty("action") String action,
    @JsonProperty("description") String description,
    @JsonProperty("priority") QueuePriority priority
) {
    public static Recommendation of(String type, String action, String description) {
        return new Recommendation(type, action, description, QueuePriority.MEDIUM);
    }

    public static Recommendation of(String type, String action, String description,
                                    QueuePriority priority) {
        return new Recommendation(type, action, description, priority);
    }
}
