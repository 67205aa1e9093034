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

import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

@Component
public class LearningTransferSystem implements AlgorithmUnit {

    public static final String NAME = "LearningTransferSystem";

    static final String CROSS_DOMAIN   = "crossDomainTransfer";
    static final String GENERALIZATION = "skillGeneralization";
    static final String CONCEPTUAL     = "conceptualTransfer";

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.NEUROPLASTICITY; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        double fallback = profile.parameter("transferCapacity", 0.5);
        double level = average(
            clamp(data.metricOr(CROSS_DOMAIN, fallback)),
            clamp(data.metricOr(GENERALIZATION, fallback)),
            clamp(data.metricOr(CONCEPTUAL, fallback)));
        double confidence = evidenceConfidence(0.7, present(data, CROSS_DOMAIN, GENERALIZATION, CONCEPTUAL), 3);

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.7) {
            insights.add(Insight.of("transfer", "Applies skills across contexts", confidence));
        }
        if (level < 0.4) {
            recs.add(Recommendation.of("transfer", "vary_context", "Practise the same skill in a new context"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.NEUROPLASTICITY, level, confidence,
            insights, recs, Map.of("transferLevel", level));
    }
}
