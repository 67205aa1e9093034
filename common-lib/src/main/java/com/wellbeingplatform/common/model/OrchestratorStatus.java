package com.wellbeingplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OrchestratorStatus(
    @JsonProperty("lifecycleState") LifecycleState lifecycleState,
    @JsonProperty("active") boolean active,
    @JsonProperty("analyzing") boolean analyzing,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("interventionDepth") int interventionDepth,
    @JsonProperty("optimizationDepth") int optimizationDepth
) {}
