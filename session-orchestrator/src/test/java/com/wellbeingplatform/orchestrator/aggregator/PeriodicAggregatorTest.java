package com.wellbeingplatform.orchestrator.aggregator;

import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.QueueKind;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionConfig;
import com.wellbeingplatform.common.model.TrendDirection;
import com.wellbeingplatform.common.model.UserProfile;
import com.wellbeingplatform.common.store.AnalysisRecordStore;
import com.wellbeingplatform.orchestrator.OrchestratorFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PeriodicAggregatorTest {

    @Mock
    private AnalysisRecordStore recordStore;

    private OrchestratorFixture fx;

    @AfterEach
    void tearDown() {
        if (fx != null) fx.aggregator.stop();
    }

    private Session started(SessionConfig config) {
        fx = new OrchestratorFixture(null, recordStore);
        fx.orchestrator.initialize(UserProfile.of("user-1"));
        return fx.orchestrator.startSession(config);
    }

    @Test
    @DisplayName("ten ticks of rising engagement classify as improving")
    void risingEngagement() {
        // Given
        Session session = started(OrchestratorFixture.config(false));

        // When
        for (int i = 0; i < 10; i++) {
            double level = 0.1 + i * (0.8 / 9);
            fx.orchestrator.processEvent(InteractionEvent.of("interaction", Map.of("engagementLevel", level)));
            assertTrue(fx.aggregator.tick(session.id()).isPresent());
        }

        // Then
        Map<String, TrendDirection> trends = fx.state.trends();
        assertEquals(TrendDirection.IMPROVING, trends.get("engagementLevel"));
        assertEquals(10, fx.orchestrator.getAnalysisHistory().size());
        verify(recordStore, times(10)).storeTick(eq(session), any(IntegratedAnalysis.class));
    }

    @Test
    @DisplayName("a tick with nothing buffered appends nothing")
    void emptyWindow() {
        Session session = started(OrchestratorFixture.config(false));

        assertEquals(Optional.empty(), fx.aggregator.tick(session.id()));
        assertTrue(fx.orchestrator.getAnalysisHistory().isEmpty());
        verifyNoInteractions(recordStore);
    }

    @Test
    @DisplayName("periodic interventions are queued at high priority")
    void periodicPriority() {
        Session session = started(OrchestratorFixture.config(false));
        fx.orchestrator.processEvent(InteractionEvent.of("error", Map.of("frustrationLevel", 0.95)));

        fx.aggregator.tick(session.id());

        assertEquals(1, fx.queues.depth(QueueKind.INTERVENTION));
        assertEquals(QueuePriority.HIGH, fx.queues.peekAll(QueueKind.INTERVENTION).get(0).priority());
    }

    @Test
    @DisplayName("store failure is absorbed and the tick still lands in history")
    void storeFailureAbsorbed() {
        Session session = started(OrchestratorFixture.config(false));
        doThrow(new IllegalStateException("disk full")).when(recordStore).storeTick(any(), any());
        fx.orchestrator.processEvent(InteractionEvent.of("interaction", Map.of("engagementLevel", 0.5)));

        assertTrue(fx.aggregator.tick(session.id()).isPresent());
        assertEquals(1, fx.orchestrator.getAnalysisHistory().size());
    }

    @Test
    @DisplayName("no tick runs after the session ends")
    void noTickAfterEnd() {
        Session session = started(OrchestratorFixture.config(false));
        fx.orchestrator.processEvent(InteractionEvent.of("interaction", Map.of("engagementLevel", 0.5)));
        assertTrue(fx.state.ticksArmed());

        fx.orchestrator.endSession();
        int historyAtEnd = fx.state.history().size();

        assertFalse(fx.state.ticksArmed());
        assertEquals(Optional.empty(), fx.aggregator.tick(session.id()));
        assertEquals(historyAtEnd, fx.state.history().size());
        verify(recordStore, never()).storeTick(any(), any());
    }

    @Test
    @DisplayName("the timer drives ticks on its own")
    void timerDrivesTicks() throws InterruptedException {
        Session session = started(SessionConfig.of("user-1", "drawing", "easy", 50, false));
        fx.orchestrator.processEvent(InteractionEvent.of("interaction", Map.of("engagementLevel", 0.5)));

        long deadline = System.currentTimeMillis() + 5_000;
        while (fx.state.history().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(1, fx.state.history().size());
        verify(recordStore, timeout(2_000)).storeTick(eq(session), any(IntegratedAnalysis.class));
    }
}
