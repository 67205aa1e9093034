package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-user tuning parameters read by Algorithm Units (e.g. {@code errorTolerance},
 * {@code baselinePerformance}). Units fall back to their own defaults for absent keys.
 */
public record UserProfile(
    @JsonProperty("userId") String userId,
    @JsonProperty("parameters") Map<String, Double> parameters
) {
    public UserProfile {
        parameters = parameters == null ? Map.of()
                                        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static UserProfile of(String userId) {
        return new UserProfile(userId, Map.of());
    }

    public static UserProfile of(String userId, Map<String, Double> parameters) {
        return new UserProfile(userId, parameters);
    }

    public double parameter(String name, double fallback) {
        Double v = parameters.get(name);
        return v == null || !Double.isFinite(v) ? fallback : v;
    }

    /** Returns a copy with {@code update}'s parameters layered over this profile's. */
    public UserProfile merge(UserProfile update) {
        if (update == null) return this;
        Map<String, Double> merged = new LinkedHashMap<>(parameters);
        merged.putAll(update.parameters());
        String id = update.userId() != null ? update.userId() : userId;
        return new UserProfile(id, merged);
    }
}
