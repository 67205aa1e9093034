package com.wellbeingplatform.orchestrator.pipeline;

import com.wellbeingplatform.common.model.AnalysisMode;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.model.QueueKind;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Recommendation;
import com.wellbeingplatform.orchestrator.config.OrchestratorSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueDecisionPolicyTest {

    private final QueueDecisionPolicy policy = new QueueDecisionPolicy(OrchestratorSettings.defaults());

    private static IntegratedAnalysis analysis(double risk, double opportunity, Map<String, Double> signals) {
        return new IntegratedAnalysis("a-" + risk + "-" + opportunity, AnalysisMode.REALTIME, 0.5, 0.8,
            risk, opportunity, List.of(), List.of(), Map.of(), signals, Map.of(), List.of(), false, Instant.now());
    }

    @Test
    @DisplayName("calm analysis queues nothing")
    void nothing() {
        assertTrue(policy.decide("s", analysis(0.2, 0.3, Map.of("frustrationLevel", 0.2)),
            QueuePriority.IMMEDIATE, QueuePriority.MEDIUM).isEmpty());
    }

    @Test
    @DisplayName("composite risk above threshold queues one intervention at the caller's priority")
    void compositeRisk() {
        List<QueueItem> items = policy.decide("s", analysis(0.75, 0.1, Map.of("frustrationLevel", 0.75)),
            QueuePriority.HIGH, QueuePriority.LOW);

        assertEquals(1, items.size());
        assertEquals(QueueKind.INTERVENTION, items.get(0).kind());
        assertEquals(QueuePriority.HIGH, items.get(0).priority());
        assertEquals("s", items.get(0).sessionId());
    }

    @Test
    @DisplayName("a single acute signal triggers an intervention even with low composite risk")
    void acuteSignal() {
        List<QueueItem> items = policy.decide("s",
            analysis(0.45, 0.1, Map.of("frustrationLevel", 0.85, "anxietyLevel", 0.0)),
            QueuePriority.IMMEDIATE, QueuePriority.MEDIUM);

        assertEquals(1, items.size());
        assertEquals(QueuePriority.IMMEDIATE, items.get(0).priority());
        assertTrue(items.get(0).reason().contains("frustrationLevel"));
    }

    @Test
    @DisplayName("opportunity signals never count as acute risk")
    void opportunitySignalIgnoredForRisk() {
        List<QueueItem> items = policy.decide("s", analysis(0.1, 0.5, Map.of("engagementLevel", 0.95)),
            QueuePriority.IMMEDIATE, QueuePriority.MEDIUM);

        assertTrue(items.isEmpty());
    }

    @Test
    @DisplayName("both checks fire independently")
    void both() {
        List<QueueItem> items = policy.decide("s", analysis(0.8, 0.8, Map.of()),
            QueuePriority.IMMEDIATE, QueuePriority.MEDIUM);

        assertEquals(List.of(QueueKind.INTERVENTION, QueueKind.OPTIMIZATION),
            items.stream().map(QueueItem::kind).toList());
        assertEquals(QueuePriority.MEDIUM, items.get(1).priority());
    }

    @Test
    @DisplayName("thresholds are strict")
    void strictThresholds() {
        assertTrue(policy.decide("s", analysis(0.7, 0.7, Map.of("frustrationLevel", 0.8)),
            QueuePriority.IMMEDIATE, QueuePriority.MEDIUM).isEmpty());
    }

    @Test
    @DisplayName("low risk with decent opportunity suggests added complexity")
    void enhancementRecommendation() {
        List<Recommendation> recs = policy.realtimeRecommendations(analysis(0.1, 0.6, Map.of()));

        assertTrue(recs.stream().anyMatch(r -> r.action().equals("introduce_complexity")));
        assertTrue(recs.stream().noneMatch(r -> r.action().equals("immediate_support")));
    }
}
