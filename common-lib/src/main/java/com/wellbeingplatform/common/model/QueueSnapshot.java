package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Point-in-time copies of both active queues. Detached from the live queues. */
public record QueueSnapshot(
    @JsonProperty("interventions") List<QueueItem> interventions,
    @JsonProperty("optimizations") List<QueueItem> optimizations
) {
    public QueueSnapshot {
        interventions = interventions == null ? List.of() : List.copyOf(interventions);
        optimizations = optimizations == null ? List.of() : List.copyOf(optimizations);
    }
}
