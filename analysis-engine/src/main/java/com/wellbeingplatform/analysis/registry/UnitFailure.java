package com.wellbeingplatform.analysis.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A unit that raised, timed out or returned nothing during a registry run. */
public record UnitFailure(
    @JsonProperty("algorithmName") String algorithmName,
    @JsonProperty("reason") String reason
) {}
