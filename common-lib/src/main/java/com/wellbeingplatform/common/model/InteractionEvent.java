package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One structured record from a Data Collector source: an event type, when it happened,
 * and free-form contextual fields ({@code responseTime}, {@code error},
 * {@code frustrationLevel}, ...).
 */
public record InteractionEvent(
    @JsonProperty("type") String type,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("fields") Map<String, Object> fields
) {
    public InteractionEvent {
        timestamp = timestamp == null ? Instant.now() : timestamp;
        fields    = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static InteractionEvent of(String type, Map<String, Object> fields) {
        return new InteractionEvent(type, Instant.now(), fields);
    }

    public static InteractionEvent of(String type, Instant timestamp, Map<String, Object> fields) {
        return new InteractionEvent(type, timestamp, fields);
    }

    /** Numeric value of {@code field}; booleans map to 1/0, anything else is absent. */
    public OptionalDouble number(String field) {
        Object v = fields.get(field);
        if (v instanceof Number n && Double.isFinite(n.doubleValue())) {
            return OptionalDouble.of(n.doubleValue());
        }
        if (v instanceof Boolean b) {
            return OptionalDouble.of(b ? 1.0 : 0.0);
        }
        return OptionalDouble.empty();
    }

    public boolean flag(String field) {
        Object v = fields.get(field);
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0.0;
        return false;
    }

    public String text(String field) {
        Object v = fields.get(field);
        return v == null ? null : String.valueOf(v);
    }

    public boolean isType(String candidate) {
        return candidate.equalsIgnoreCase(type);
    }
}
