package com.wellbeingplatform.orchestrator.pipeline;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.AnalysisMode;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.common.model.SessionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionOutcomeEvaluatorTest {

    private final SessionOutcomeEvaluator evaluator = new SessionOutcomeEvaluator();

    private static IntegratedAnalysis finalAnalysis(Double emotional, Double neuro, List<Recommendation> recs) {
        Map<AlgorithmFamily, Double> families = new EnumMap<>(AlgorithmFamily.class);
        if (emotional != null) families.put(AlgorithmFamily.EMOTIONAL, emotional);
        if (neuro != null) families.put(AlgorithmFamily.NEUROPLASTICITY, neuro);
        return new IntegratedAnalysis("final", AnalysisMode.FINAL, 0.5, 0.8, 0.2, 0.4,
            List.of(), recs, Map.of(), Map.of(), families, List.of(), false, Instant.now());
    }

    @Test
    @DisplayName("blends both family scores with fixed shares")
    void blends() {
        SessionOutcome o = evaluator.evaluate(finalAnalysis(0.5, 1.0, List.of()));

        assertEquals(0.6 * 0.5 + 0.4 * 1.0, o.overallWellbeing(), 1e-9);
        assertEquals(0.3 * 0.5 + 0.7 * 1.0, o.learningEffectiveness(), 1e-9);
        assertEquals(0.5, o.emotionalStability(), 1e-9);
        assertEquals(1.0, o.cognitiveGrowth(), 1e-9);
        assertTrue(o.recommendations().stream().anyMatch(r -> r.type().equals("advancement")));
        assertTrue(o.insights().stream().anyMatch(i -> i.type().equals("growth")));
    }

    @Test
    @DisplayName("a missing family drops out and the remaining share renormalises")
    void missingFamily() {
        SessionOutcome o = evaluator.evaluate(finalAnalysis(0.3, null, List.of()));

        assertEquals(0.3, o.overallWellbeing(), 1e-9);
        assertEquals(0.3, o.learningEffectiveness(), 1e-9);
        assertEquals(0.0, o.cognitiveGrowth(), 1e-9);
        Recommendation wellbeing = o.recommendations().get(0);
        assertEquals("wellbeing", wellbeing.type());
        assertEquals(QueuePriority.HIGH, wellbeing.priority());
    }

    @Test
    @DisplayName("no-data analysis yields zeros and no recommendations")
    void noData() {
        SessionOutcome o = evaluator.evaluate(IntegratedAnalysis.noData(AnalysisMode.FINAL, "empty"));

        assertEquals(0.0, o.overallWellbeing());
        assertTrue(o.recommendations().isEmpty());
    }

    @Test
    @DisplayName("merge keeps outcome recommendations first and drops repeated actions")
    void merge() {
        Recommendation unit = Recommendation.of("engagement", "increase_interactivity", "more");
        Recommendation dup  = Recommendation.of("engagement", "increase_interactivity", "again");
        IntegratedAnalysis fin = finalAnalysis(0.2, 0.2, List.of(unit, dup));

        List<Recommendation> merged = evaluator.merge(evaluator.evaluate(fin), fin);

        assertEquals(List.of("wellbeing_support", "increase_interactivity"),
            merged.stream().map(Recommendation::action).toList());
    }
}
