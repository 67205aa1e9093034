package com.wellbeingplatform.analysis.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;

import java.util.List;

/**
 * Outcome of one registry dispatch: successful results in declaration order plus a
 * failure record per unit that produced none.
 */
public record RegistryRun(
    @JsonProperty("family") AlgorithmFamily family,
    @JsonProperty("results") List<AlgorithmResult> results,
    @JsonProperty("failures") List<UnitFailure> failures
) {
    public RegistryRun {
        results  = results == null ? List.of() : List.copyOf(results);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static RegistryRun empty(AlgorithmFamily family) {
        return new RegistryRun(family, List.of(), List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
