package com.wellbeingplatform.analysis.algorithm.emotional;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.common.integration.IndicatorCalculator;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.common.model.SessionData;
import com.wellbeingplatform.common.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Anxiety from hesitation, error rate and help-seeking, scaled by the profile's
 * {@code anxietySensitivity} (0.5 is neutral).
 */
@Component
public class AnxietyDetector implements AlgorithmUnit {

    private static final Logger log = LoggerFactory.getLogger(AnxietyDetector.class);

    public static final String NAME = "AnxietyDetector";

    static final double RAPID_ACTIONS_PER_SECOND = 3.0;
    static final double HESITATION_PAUSE_MS      = 3000.0;

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        log.debug("[AnxietyDetector] session={}", data.sessionId());
        OptionalDouble explicit = reading(data, IndicatorCalculator.ANXIETY);
        if (explicit.isPresent()) {
            return build(clamp(explicit.getAsDouble()), 0.85);
        }
        double events     = Math.max(data.metricOr(EVENT_COUNT, 0.0), 1.0);
        double hesitation = clamp(data.metricOr(PAUSE_DURATION, 0.0) / 5000.0);
        double errors     = clamp(data.metricOr(ERROR_RATE, 0.0));
        double help       = clamp(data.metricOr(HELP_REQUESTS, 0.0) / events * 2);
        double level      = clamp((0.5 * hesitation + 0.3 * errors + 0.2 * help) * sensitivity(profile));
        return build(level, evidenceConfidence(0.75, present(data, PAUSE_DURATION, ERROR_RATE, HELP_REQUESTS), 3));
    }

    @Override
    public AlgorithmResult executeRealtime(UserProfile profile, SessionData window) {
        OptionalDouble explicit = window.latestReading(IndicatorCalculator.ANXIETY);
        if (explicit.isPresent()) {
            return build(clamp(explicit.getAsDouble()), 0.9);
        }
        InteractionEvent latest = window.latestEvent().orElse(null);
        if (latest == null) {
            return build(0.0, 0.3);
        }
        double actions = latest.number(ACTIONS_PER_SECOND).orElse(latest.number(CLICKS_PER_SECOND).orElse(0.0));
        double rapid      = actions > RAPID_ACTIONS_PER_SECOND ? 1.0 : 0.0;
        double hesitation = latest.number(PAUSE_DURATION).orElse(0.0) > HESITATION_PAUSE_MS ? 1.0 : 0.0;
        return build(clamp((rapid + hesitation) / 2 * sensitivity(profile)), 0.65);
    }

    private static double sensitivity(UserProfile profile) {
        return 0.75 + 0.5 * clamp(profile.parameter("anxietySensitivity", 0.5));
    }

    private AlgorithmResult build(double level, double confidence) {
        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.6) {
            insights.add(Insight.of("anxiety", "Signs of anxiety: hesitation and rapid corrections", confidence));
            recs.add(Recommendation.of("calming", "breathing_exercise", "Offer a short calming exercise"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, 1.0 - level, confidence,
            insights, recs, Map.of(IndicatorCalculator.ANXIETY, level));
    }
}
