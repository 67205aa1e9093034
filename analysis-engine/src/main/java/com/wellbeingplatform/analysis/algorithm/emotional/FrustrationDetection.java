package com.wellbeingplatform.analysis.algorithm.emotional;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
import com.wellbeingplatform.common.integration.IndicatorCalculator;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AlgorithmResult;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.QueuePriority;
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
 * Estimates frustration from error rate, slow responses, retries and help requests.
 * An explicit {@code frustrationLevel} reading wins over the derived estimate.
 *
 * <p>Real-time passes look for spikes on the latest event: click storms above
 * {@value #SPIKE_CLICKS_PER_SECOND}/s, pauses over {@value #SPIKE_PAUSE_MS} ms, or an error.
 */
@Component
public class FrustrationDetection implements AlgorithmUnit {

    private static final Logger log = LoggerFactory.getLogger(FrustrationDetection.class);

    public static final String NAME = "FrustrationDetection";

    static final double SPIKE_CLICKS_PER_SECOND = 5.0;
    static final double SPIKE_PAUSE_MS          = 5000.0;
    private static final double WARNING_LEVEL   = 0.6;
    private static final double SUPPORT_LEVEL   = 0.5;
    private static final double BREAK_LEVEL     = 0.8;

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        log.debug("[FrustrationDetection] session={} metrics={}", data.sessionId(), data.metrics().size());

        OptionalDouble explicit = reading(data, IndicatorCalculator.FRUSTRATION);
        double level;
        double confidence;
        if (explicit.isPresent()) {
            level = clamp(explicit.getAsDouble());
            confidence = 0.85;
        } else {
            double tolerance = profile.parameter("errorTolerance", 0.3);
            double threshold = profile.parameter("frustrationTimeMs", 5000.0);
            double events    = Math.max(data.metricOr(EVENT_COUNT, 0.0), 1.0);

            double errors   = clamp(ratio(data.metricOr(ERROR_RATE, 0.0), tolerance * 2));
            double response = clamp(ratio(data.metricOr(RESPONSE_TIME, 0.0), threshold * 2));
            double retries  = clamp(data.metricOr(RETRY_ATTEMPTS, 0.0) / events * 2);
            double help     = clamp(data.metricOr(HELP_REQUESTS, 0.0) / events * 3);
            level = clamp(0.4 * errors + 0.2 * response + 0.2 * retries + 0.2 * help);
            confidence = evidenceConfidence(0.8, present(data, ERROR_RATE, RESPONSE_TIME, RETRY_ATTEMPTS, HELP_REQUESTS), 4);
        }
        return build(level, confidence);
    }

    @Override
    public AlgorithmResult executeRealtime(UserProfile profile, SessionData window) {
        OptionalDouble explicit = window.latestReading(IndicatorCalculator.FRUSTRATION);
        if (explicit.isPresent()) {
            return build(clamp(explicit.getAsDouble()), 0.9);
        }
        InteractionEvent latest = window.latestEvent().orElse(null);
        if (latest == null) {
            return build(0.0, 0.3);
        }
        double spike = 0.0;
        if (latest.number(CLICKS_PER_SECOND).orElse(0.0) > SPIKE_CLICKS_PER_SECOND) spike += 0.4;
        if (latest.number(PAUSE_DURATION).orElse(0.0) > SPIKE_PAUSE_MS)            spike += 0.3;
        if (latest.isType("error") || latest.flag("error"))                         spike += 0.3;
        double level = clamp(spike + 0.3 * window.metricOr(ERROR_RATE, 0.0));
        return build(level, 0.7);
    }

    private AlgorithmResult build(double level, double confidence) {
        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > WARNING_LEVEL) {
            insights.add(Insight.of("frustration", String.format("Elevated frustration detected (%.2f)", level), confidence));
        }
        if (level > SUPPORT_LEVEL) {
            recs.add(Recommendation.of("support", "offer_hint", "Offer a hint or simplify the current step"));
        }
        if (level > BREAK_LEVEL) {
            recs.add(Recommendation.of("break", "suggest_break", "Suggest a short break", QueuePriority.HIGH));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, 1.0 - level, confidence,
            insights, recs, Map.of(IndicatorCalculator.FRUSTRATION, level));
    }
}
