package com.wellbeingplatform.common.integration;

import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.IntegratedAnalysis;

import java.util.List;

/**
 * Strategy contract for combining Algorithm Unit results into one
 * {@link IntegratedAnalysis}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b> — safe to call concurrently from both processing paths</li>
 *   <li><b>Pure</b>      — no logging, no reactive types, no side effects</li>
 *   <li><b>Total</b>     — never throw and never return {@code null}, including for
 *       {@code null} or empty input</li>
 * </ul>
 */
public interface WeightedIntegrator {

    /**
     * @param results unit results of one pass, may be {@code null} or empty
     * @param weights the weight table the pass was run against
     * @return the integrated analysis; {@code mode} is left {@code null} for the caller to set
     */
    IntegratedAnalysis integrate(List<AlgorithmResult> results, WeightTable weights);
}
