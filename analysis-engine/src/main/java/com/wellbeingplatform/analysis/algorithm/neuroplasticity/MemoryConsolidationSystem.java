package com.wellbeingplatform.analysis.algorithm.neuroplasticity;

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

import static com.wellbeingplatform.analysis.collector.SessionMetrics.ACCURACY;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Mean of retention, recall accuracy and transfer success. Plain {@code accuracy} stands
 * in for recall when no recall reading exists.
 */
@Component
public class MemoryConsolidationSystem implements AlgorithmUnit {

    public static final String NAME = "MemoryConsolidationSystem";

    static final String RETENTION = "retentionRate";
    static final String RECALL    = "recallAccuracy";
    static final String TRANSFER  = "transferSuccess";

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.NEUROPLASTICITY; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        double fallback  = profile.parameter("memoryCapacity", 0.5);
        double retention = clamp(data.metricOr(RETENTION, fallback));
        double recall    = clamp(data.metricOr(RECALL, data.metricOr(ACCURACY, fallback)));
        double transfer  = clamp(data.metricOr(TRANSFER, fallback));
        double level     = average(retention, recall, transfer);
        double confidence = evidenceConfidence(0.75, present(data, RETENTION, RECALL, ACCURACY, TRANSFER), 3);

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.7) {
            insights.add(Insight.of("memory", "Material is consolidating well", confidence));
        }
        if (level < 0.4) {
            recs.add(Recommendation.of("memory", "spaced_repetition", "Schedule a spaced review of recent material"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.NEUROPLASTICITY, level, confidence,
            insights, recs, Map.of("memoryConsolidation", level));
    }
}
