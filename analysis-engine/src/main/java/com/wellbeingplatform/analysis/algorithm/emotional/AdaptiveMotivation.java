package com.wellbeingplatform.analysis.algorithm.emotional;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.common.integration.IndicatorCalculator;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Motivation = persistence (retries, saturating at three) × 0.3 + progress × 0.5
 * + time invested (saturating at ten minutes) × 0.2.
 */
@Component
public class AdaptiveMotivation implements AlgorithmUnit {

    public static final String NAME = "AdaptiveMotivation";

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        OptionalDouble explicit = reading(data, IndicatorCalculator.MOTIVATION);
        double level;
        double confidence;
        if (explicit.isPresent()) {
            level = clamp(explicit.getAsDouble());
            confidence = 0.85;
        } else {
            double persistence = Math.min(data.metricOr(RETRY_ATTEMPTS, 0.0), 3.0) / 3.0;
            double progress    = clamp(data.metricOr(PROGRESS_SCORE, data.metricOr(COMPLETION_RATE, 0.0)));
            double invested    = clamp(data.metricOr(TIME_SPENT_MS, 0.0) / 600_000.0);
            level = clamp(0.3 * persistence + 0.5 * progress + 0.2 * invested);
            confidence = evidenceConfidence(0.75, present(data, RETRY_ATTEMPTS, PROGRESS_SCORE, TIME_SPENT_MS), 3);
        }

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.7) {
            insights.add(Insight.of("motivation", "Strong intrinsic motivation", confidence));
        }
        if (level < 0.3) {
            recs.add(Recommendation.of("motivation", "provide_encouragement", "Acknowledge progress and set a small goal"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, level, confidence,
            insights, recs, Map.of(IndicatorCalculator.MOTIVATION, level));
    }
}
