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

import static com.wellbeingplatform.analysis.collector.SessionMetrics.PERFORMANCE_TREND;
import static com.wellbeingplatform.analysis.indicator.ScoreMath.*;

/**
 * Looks for sudden jumps: a performance rise of {@value #JUMP} or more, newly grasped
 * concepts and newly acquired skills. A score above the profile's
 * {@code breakthroughThreshold} (default 0.85) is reported as a breakthrough.
 */
@Component
public class CognitiveBreakthroughDetector implements AlgorithmUnit {

    public static final String NAME = "CognitiveBreakthroughDetector";

    static final double JUMP           = 0.3;
    static final String NEW_CONCEPTS   = "newConceptsGrasped";
    static final String SKILLS         = "skillsAcquired";
    static final String COMPLEXITY     = "conceptComplexity";
    static final String MASTERY        = "masteryLevel";

    @Override
    public String algorithmName() { return NAME; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.NEUROPLASTICITY; }

    @Override
    public AlgorithmResult execute(UserProfile profile, SessionData data) {
        double jump          = clamp(data.metricOr(PERFORMANCE_TREND, 0.0) / JUMP);
        double understanding = clamp(data.metricOr(NEW_CONCEPTS, 0.0) * data.metricOr(COMPLEXITY, 0.5) / 3.0);
        double mastery       = clamp(data.metricOr(SKILLS, 0.0) * data.metricOr(MASTERY, 0.5) / 2.0);
        double score         = average(jump, understanding, mastery);
        double confidence    = evidenceConfidence(0.7, present(data, PERFORMANCE_TREND, NEW_CONCEPTS, SKILLS), 3);
        double threshold     = profile.parameter("breakthroughThreshold", 0.85);

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recs = new ArrayList<>();
        if (score > threshold) {
            insights.add(Insight.of("breakthrough", "Cognitive breakthrough detected", confidence));
        }
        if (score > 0.7) {
            recs.add(Recommendation.of("breakthrough", "introduce_advanced_concepts", "Build on the breakthrough with advanced material"));
        }
        return AlgorithmResult.of(NAME, AlgorithmFamily.NEUROPLASTICITY, score, confidence,
            insights, recs, Map.of("breakthroughLevel", score));
    }
}
