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

import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * How quickly the user settles after setbacks: recovery time, self-soothing actions and
 * emotional awareness. Missing awareness falls back to the profile's {@code regulationCapacity}.
 */
@Component
public class EmotionalRegulationSystem implements AlgorithmUnit {

    public static final String NAME = "EmotionalRegulationSystem";

    static final String RECOVERY_TIME  = "emotionalRecoveryTime";
    static final String SELF_SOOTHING  = "selfSoothingActions";
    static final String AWARENESS      = "emotionalAwareness";
    static final String REGULATION     = "regulationLevel";

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        double recovery  = clamp(1.0 - data.metricOr(RECOVERY_TIME, 0.0) / 10_000.0);
        double soothing  = clamp(data.metricOr(SELF_SOOTHING, 0.0));
        double awareness = clamp(data.metricOr(AWARENESS, profile.parameter("regulationCapacity", 0.6)));
        double level     = clamp(0.4 * recovery + 0.3 * soothing + 0.3 * awareness);
        double confidence = evidenceConfidence(0.7, present(data, RECOVERY_TIME, SELF_SOOTHING, AWARENESS), 3);

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.7) {
            insights.add(Insight.of("regulation", "Recovers composure quickly after setbacks", confidence));
        }
        if (level < 0.4) {
            recs.add(Recommendation.of("regulation", "guided_reflection", "Offer a guided reflection after difficult steps"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.EMOTIONAL, level, confidence,
            insights, recs, Map.of(REGULATION, level));
    }
}
