package com.wellbeingplatform.analysis.algorithm.neuroplasticity;

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

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Learning readiness: mean of attention, motivation, spare cognitive capacity and
 * accuracy. Each input defaults to 0.5.
 */
@Component
public class OpportunityWindowIdentifier implements AlgorithmUnit {

    public static final String NAME = "OpportunityWindowIdentifier";

    static final String READINESS = "learningReadiness";

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.NEUROPLASTICITY; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        double attention  = clamp(reading(data, ATTENTION_LEVEL).orElse(0.5));
        double motivation = clamp(reading(data, IndicatorCalculator.MOTIVATION).orElse(0.5));
        double capacity   = clamp(1.0 - reading(data, COGNITIVE_LOAD).orElse(0.5));
        double accuracy   = data.hasMetric(ERROR_RATE) ? clamp(1.0 - data.metricOr(ERROR_RATE, 0.0)) : 0.5;
        double readiness  = average(attention, motivation, capacity, accuracy);
        double confidence = evidenceConfidence(0.75,
            present(data, ATTENTION_LEVEL, IndicatorCalculator.MOTIVATION, COGNITIVE_LOAD, ERROR_RATE), 4);

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (readiness > 0.7) {
            insights.add(Insight.of("opportunity", "Optimal learning window is open", confidence));
        }
        if (readiness > 0.6) {
            recs.add(Recommendation.of("opportunity", "introduce_new_concepts", "Introduce a new concept while readiness is high"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.NEUROPLASTICITY, readiness, confidence,
            insights, recs, Map.of(READINESS, readiness));
    }
}
