package com.wellbeingplatform.orchestrator.pipeline;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.Insight;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.common.model.SessionOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-level outcome from the final analysis' family scores.
 *
 * <pre>
 *   overallWellbeing      = 0.6 × emotional + 0.4 × neuroplasticity
 *   learningEffectiveness = 0.3 × emotional + 0.7 × neuroplasticity
 *   emotionalStability    = emotional
 *   cognitiveGrowth       = neuroplasticity
 * </pre>
 * A family absent from the final pass drops out and the remaining share is
 * renormalised. With no family score at all the outcome is all zeros and carries no
 * recommendations.
 *
 * <p>Stateless; no logging.
 */
@Component
public class SessionOutcomeEvaluator {

    static final double LOW_WELLBEING      = 0.4;
    static final double HIGH_EFFECTIVENESS = 0.7;
    static final double STRONG_GROWTH      = 0.6;

    public SessionOutcome evaluate(IntegratedAnalysis finalAnalysis) {
        Map<AlgorithmFamily, Double> scores = finalAnalysis == null ? Map.of() : finalAnalysis.familyScores();
        if (scores.isEmpty()) {
            return new SessionOutcome(0.0, 0.0, 0.0, 0.0, List.of(), List.of());
        }

        Double emotional = scores.get(AlgorithmFamily.EMOTIONAL);
        Double neuro     = scores.get(AlgorithmFamily.NEUROPLASTICITY);
        double wellbeing     = blend(emotional, 0.6, neuro, 0.4);
        double effectiveness = blend(emotional, 0.3, neuro, 0.7);
        double stability     = emotional == null ? 0.0 : emotional;
        double growth        = neuro == null ? 0.0 : neuro;

        List<Recommendation> recs = new ArrayList<>();
        List<Insight> insights = new ArrayList<>();
        if (wellbeing < LOW_WELLBEING) {
            recs.add(Recommendation.of("wellbeing", "wellbeing_support",
                "Wellbeing was low this session; plan a gentler next session", QueuePriority.HIGH));
        }
        if (effectiveness > HIGH_EFFECTIVENESS) {
            recs.add(Recommendation.of("advancement", "advance_level",
                "Learning was effective; advance to the next level", QueuePriority.MEDIUM));
        }
        if (growth > STRONG_GROWTH) {
            insights.add(Insight.of("growth", String.format("Strong cognitive growth (%.2f)", growth), growth));
        }
        return new SessionOutcome(wellbeing, effectiveness, stability, growth, recs, insights);
    }

    /**
     * Final recommendation list: outcome recommendations first, then the analysis'
     * own, keeping the first occurrence of each action.
     */
    public List<Recommendation> merge(SessionOutcome outcome, IntegratedAnalysis finalAnalysis) {
        Map<String, Recommendation> byAction = new LinkedHashMap<>();
        outcome.recommendations().forEach(r -> byAction.putIfAbsent(r.action(), r));
        if (finalAnalysis != null) {
            finalAnalysis.recommendations().forEach(r -> byAction.putIfAbsent(r.action(), r));
        }
        return List.copyOf(byAction.values());
    }

    private static double blend(Double a, double wa, Double b, double wb) {
        double sum = 0.0;
        double weight = 0.0;
        if (a != null) { sum += a * wa; weight += wa; }
        if (b != null) { sum += b * wb; weight += wb; }
        return weight > 0.0 ? sum / weight : 0.0;
    }
}
