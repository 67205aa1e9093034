package com.wellbeingplatform.analysis.algorithm.emotional;

import com.wellbeingplatform.analysis.algorithm.AlgorithmUnit;
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

import static com.wellbeingplatform.analysis.collector.SessionMetrics.DISTINCT_EVENT_TYPES;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Mean of originality, variety of expression and emotional depth, each defaulting to 0.5.
 * When no variety reading exists, the number of distinct event types stands in for it.
 */
@Component
public class CreativeExpressionAnalysis implements AlgorithmUnit {

    public static final String NAME = "CreativeExpressionAnalysis";

    static final String ORIGINALITY = "originalityScore";
    static final String VARIETY     = "varietyOfExpression";
    static final String DEPTH       = "emotionalDepth";

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        double originality = clamp(data.metricOr(ORIGINALITY, 0.5));
        double variety = data.hasMetric(VARIETY)
            ? clamp(data.metricOr(VARIETY, 0.5))
            : data.hasMetric(DISTINCT_EVENT_TYPES) ? clamp(data.metricOr(DISTINCT_EVENT_TYPES, 0.0) / 6.0) : 0.5;
        double depth = clamp(data.metricOr(DEPTH, 0.5));
        double level = average(originality, variety, depth);
        double confidence = evidenceConfidence(0.7, present(data, ORIGINALITY, VARIETY, DEPTH), 3);

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.7) {
            insights.add(Insight.of("creativity", "Rich and varied creative expression", confidence));
        }
        if (level < 0.4) {
            recs.add(Recommendation.of("creativity", "open_prompt", "Offer an open-ended creative prompt"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, level, confidence,
            insights, recs, Map.of("creativeExpression", level));
    }
}
