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
 * Engagement as the mean of time on task (saturating at five minutes), interaction
 * volume (saturating at fifty events) and completion rate. Compared against the
 * profile's {@code baselineEngagement}.
 */
@Component
public class EmotionalEngagementAnalysis implements AlgorithmUnit {

    public static final String NAME = "EmotionalEngagementAnalysis";

    private static final double FULL_TIME_MS      = 300_000.0;
    private static final double FULL_INTERACTIONS = 50.0;

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        OptionalDouble explicit = reading(data, IndicatorCalculator.ENGAGEMENT);
        double level;
        double confidence;
        if (explicit.isPresent()) {
            level = clamp(explicit.getAsDouble());
            confidence = 0.85;
        } else {
            double time         = clamp(data.metricOr(TIME_SPENT_MS, 0.0) / FULL_TIME_MS);
            double interactions = clamp(data.metricOr(EVENT_COUNT, 0.0) / FULL_INTERACTIONS);
            double completion   = clamp(data.metricOr(COMPLETION_RATE, 0.0));
            level = average(time, interactions, completion);
            confidence = evidenceConfidence(0.8, present(data, TIME_SPENT_MS, EVENT_COUNT, COMPLETION_RATE), 3);
        }

        double baseline = profile.parameter("baselineEngagement", 0.5);
        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.7) {
            insights.add(Insight.of("engagement", "High emotional engagement", confidence));
        } else if (level < baseline - 0.2) {
            insights.add(Insight.of("engagement", String.format("Engagement %.2f is below the user's baseline %.2f", level, baseline), confidence));
        }
        if (level < 0.3) {
            recs.add(Recommendation.of("engagement", "increase_interactivity", "Introduce more interactive elements"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, level, confidence,
            insights, recs, Map.of(IndicatorCalculator.ENGAGEMENT, level));
    }
}
