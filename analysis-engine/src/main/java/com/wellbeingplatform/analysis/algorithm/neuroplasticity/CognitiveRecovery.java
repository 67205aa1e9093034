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

import static com.wellbeingplatform.analysis.collector.SessionMetrics.ERROR_RECOVERY_TIME;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Resilience after errors: recovery speed (10 s or more scores 0), adaptation speed and
 * persistence. Persistence falls back to the profile's {@code recoveryRate}.
 */
@Component
public class CognitiveRecovery implements AlgorithmUnit {

    public static final String NAME = "CognitiveRecovery";

    static final String ADAPTATION  = "adaptationSpeed";
    static final String PERSISTENCE = "persistenceLevel";

    private static final double SLOW_RECOVERY_MS = 10_000.0;
    private static final double DEFAULT_RECOVERY_MS = 5_000.0;

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.NEUROPLASTICITY; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        return score(profile, data, data.metricOr(ERROR_RECOVERY_TIME, DEFAULT_RECOVERY_MS));
    }

    @Override
    public AlgorithmResult executeRealtime(UserProfile profile, SessionData window) {
        double recoveryMs = reading(window, ERROR_RECOVERY_TIME).orElse(DEFAULT_RECOVERY_MS);
        return score(profile, window, recoveryMs);
    }

    private AlgorithmResult score(UserProfile profile, SessionData data, double recoveryMs) {
        double speed       = clamp(1.0 - recoveryMs / SLOW_RECOVERY_MS);
        double adaptation  = clamp(data.metricOr(ADAPTATION, 0.5));
        double persistence = clamp(data.metricOr(PERSISTENCE, profile.parameter("recoveryRate", 0.5)));
        double level       = average(speed, adaptation, persistence);
        double confidence  = evidenceConfidence(0.75, present(data, ERROR_RECOVERY_TIME, ADAPTATION, PERSISTENCE), 3);

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (level > 0.7) {
            insights.add(Insight.of("recovery", "Bounces back quickly from mistakes", confidence));
        }
        if (level < 0.4) {
            recs.add(Recommendation.of("recovery", "scaffold_errors", "Add worked examples after errors"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.NEUROPLASTICITY, level, confidence,
            insights, recs, Map.of("recoveryLevel", level));
    }
}
