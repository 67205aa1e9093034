package com.wellbeingplatform.analysis.algorithm.neuroplasticity;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.common.integration.IndicatorCalculator;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Tracks performance against the profile's {@code baselinePerformance}.
 *
 * <pre>
 *   relative    = (performance − baseline) / baseline
 *   score       = clamp(0.5 + relative / 2)
 *   potential   = mean(score, clamp(0.5 + 2 × performanceTrend))
 *   overload    = cognitiveLoad reading, else responseTime / 8 s
 * </pre>
 * Emits {@code improvementPotential} always and {@code cognitiveOverload} only when
 * there is load or response-time evidence.
 */
@Component
public class CognitiveImprovementTracker implements AlgorithmUnit {

    private static final Logger log = LoggerFactory.getLogger(CognitiveImprovementTracker.class);

    public static final String NAME = "CognitiveImprovementTracker";

    private static final double OVERLOAD_RESPONSE_MS = 8000.0;

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.NEUROPLASTICITY; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        log.debug("[CognitiveImprovementTracker] session={}", data.sessionId());
        double baseline = profile.parameter("baselinePerformance", 0.5);
        if (baseline <= 0.0) baseline = 0.5;

        OptionalDouble performance = reading(data, PERFORMANCE);
        if (performance.isEmpty()) performance = reading(data, ACCURACY);
        double current  = performance.orElse(baseline);
        double relative = (current - baseline) / baseline;
        double score    = clamp(0.5 + relative / 2);

        OptionalDouble explicitPotential = reading(data, IndicatorCalculator.IMPROVEMENT_POTENTIAL);
        double potential = explicitPotential.isPresent()
            ? clamp(explicitPotential.getAsDouble())
            : average(score, clamp(0.5 + 2 * data.metricOr(PERFORMANCE_TREND, 0.0)));

        Map<String, Double> signals = new LinkedHashMap<>();
        signals.put(IndicatorCalculator.IMPROVEMENT_POTENTIAL, potential);
        OptionalDouble overload = overload(data);
        overload.ifPresent(v -> signals.put(IndicatorCalculator.COGNITIVE_OVERLOAD, clamp(v)));

        double confidence = evidenceConfidence(0.8, present(data, PERFORMANCE, PERFORMANCE_TREND, COGNITIVE_LOAD), 3);
        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (relative > 0.2) {
            insights.add(Insight.of("improvement", String.format("Performance %.0f%% above baseline", relative * 100), confidence));
        }
        if (score > 0.75) {
            recs.add(Recommendation.of("challenge", "increase_difficulty", "Raise the difficulty one step"));
        }
        if (overload.isPresent() && overload.getAsDouble() > 0.7) {
            recs.add(Recommendation.of("load", "reduce_load", "Break the task into smaller steps"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.NEUROPLASTICITY, score, confidence,
            insights, recs, signals);
    }

    private static OptionalDouble overload(SessionData data) {
        OptionalDouble explicit = reading(data, IndicatorCalculator.COGNITIVE_OVERLOAD);
        if (explicit.isPresent()) return explicit;
        OptionalDouble load = reading(data, COGNITIVE_LOAD);
        if (load.isPresent()) return load;
        OptionalDouble response = data.metric(RESPONSE_TIME);
        return response.isPresent()
            ? OptionalDouble.of(response.getAsDouble() / OVERLOAD_RESPONSE_MS)
            : OptionalDouble.empty();
    }
}
