package com.wellbeingplatform.analysis.registry;

import com.wellbeingplatform.analysis.algorithm.emotional.AdaptiveMotivation;
import com.wellbeingplatform.analysis.algorithm.emotional.AnxietyDetector;
import com.wellbeingplatform.analysis.algorithm.emotional.ColorPsychologicalAnalysis;
import com.wellbeingplatform.analysis.algorithm.emotional.CreativeExpressionAnalysis;
import com.wellbeingplatform.analysis.algorithm.emotional.EmotionalEngagementAnalysis;
import com.wellbeingplatform.analysis.algorithm.emotional.EmotionalRegulationSystem;
import com.wellbeingplatform.analysis.algorithm.emotional.FrustrationDetection;
import com.wellbeingplatform.analysis.algorithm.neuroplasticity.CognitiveBreakthroughDetector;
import com.wellbeingplatform.analysis.algorithm.neuroplasticity.CognitiveImprovementTracker;
import com.wellbeingplatform.analysis.algorithm.neuroplasticity.CognitiveRecovery;
import com.wellbeingplatform.analysis.algorithm.neuroplasticity.LearningTransferSystem;
import com.wellbeingplatform.analysis.algorithm.neuroplasticity.MemoryConsolidationSystem;
import com.wellbeingplatform.analysis.algorithm.neuroplasticity.OpportunityWindowIdentifier;
import com.wellbeingplatform.common.model.AlgorithmFamily;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default weight tables and real-time priority subsets for both families.
 * Map order is declaration order.
 */
public final class AlgorithmCatalog {

    private static final Map<String, Double> EMOTIONAL_WEIGHTS;
    private static final Map<String, Double> NEUROPLASTICITY_WEIGHTS;

    static {
        Map<String, Double> emotional = new LinkedHashMap<>();
        emotional.put(ColorPsychologicalAnalysis.NAME,  0.15);
        emotional.put(FrustrationDetection.NAME,        0.20);
        emotional.put(EmotionalEngagementAnalysis.NAME, 0.20);
        emotional.put(AnxietyDetector.NAME,             0.15);
        emotional.put(AdaptiveMotivation.NAME,          0.10);
        emotional.put(EmotionalRegulationSystem.NAME,   0.10);
        emotional.put(CreativeExpressionAnalysis.NAME,  0.10);
        EMOTIONAL_WEIGHTS = Collections.unmodifiableMap(emotional);

        Map<String, Double> neuro = new LinkedHashMap<>();
        neuro.put(CognitiveImprovementTracker.NAME,   0.25);
        neuro.put(OpportunityWindowIdentifier.NAME,   0.20);
        neuro.put(MemoryConsolidationSystem.NAME,     0.15);
        neuro.put(CognitiveBreakthroughDetector.NAME, 0.15);
        neuro.put(CognitiveRecovery.NAME,             0.15);
        neuro.put(LearningTransferSystem.NAME,        0.10);
        NEUROPLASTICITY_WEIGHTS = Collections.unmodifiableMap(neuro);
    }

    private static final List<String> EMOTIONAL_REALTIME = List.of(
        FrustrationDetection.NAME, AnxietyDetector.NAME,
        EmotionalEngagementAnalysis.NAME, AdaptiveMotivation.NAME);

    private static final List<String> NEUROPLASTICITY_REALTIME = List.of(
        CognitiveImprovementTracker.NAME, OpportunityWindowIdentifier.NAME, CognitiveRecovery.NAME);

    private AlgorithmCatalog() {}

    public static Map<String, Double> defaultWeights(AlgorithmFamily family) {
        return family == AlgorithmFamily.EMOTIONAL ? EMOTIONAL_WEIGHTS : NEUROPLASTICITY_WEIGHTS;
    }

    public static List<String> realtimeSubset(AlgorithmFamily family) {
        return family == AlgorithmFamily.EMOTIONAL ? EMOTIONAL_REALTIME : NEUROPLASTICITY_REALTIME;
    }
}
