package com.wellbeingplatform.orchestrator.lifecycle;

import com.wellbeingplatform.analysis.collector.EmotionalDataCollector;
import com.wellbeingplatform.analysis.collector.NeuroplasticityDataCollector;
import com.wellbeingplatform.common.collector.DataCollectorAdapter;
import com.wellbeingplatform.common.exception.CollectorUnavailableException;
import com.wellbeingplatform.common.exception.InvalidStateException;
import com.wellbeingplatform.common.exception.NoActiveSessionException;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.IntegratedAnalysis;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.LifecycleState;
import com.wellbeingplatform.common.model.QueueItem;
import com.wellbeingplatform.common.model.QueueKind;
import com.wellbeingplatform.common.model.QueuePriority;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionReport;
import com.wellbeingplatform.common.model.SessionStatus;
import com.wellbeingplatform.common.model.UserProfile;
import com.wellbeingplatform.orchestrator.OrchestratorFixture;
import com.wellbeingplatform.orchestrator.pipeline.DualFamilyAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionLifecycleManagerTest {

    private OrchestratorFixture fx;

    @BeforeEach
    void setUp() {
        fx = new OrchestratorFixture();
    }

    @AfterEach
    void tearDown() {
        fx.aggregator.stop();
    }

    // ── state machine ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("state machine")
    class StateMachine {

        @Test
        @DisplayName("start before initialize is rejected")
        void startUninitialized() {
            InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> fx.lifecycle.start(OrchestratorFixture.config(true)));
            assertEquals(LifecycleState.IDLE, e.getState());
        }

        @Test
        @DisplayName("start while active is rejected and the running session is untouched")
        void startWhileActive() {
            fx.orchestrator.initialize(UserProfile.of("user-1"));
            Session first = fx.lifecycle.start(OrchestratorFixture.config(true));

            assertThrows(InvalidStateException.class, () -> fx.lifecycle.start(OrchestratorFixture.config(true)));
            assertEquals(first, fx.state.activeSession().orElseThrow());
        }

        @Test
        @DisplayName("end while idle raises no-active-session")
        void endWhileIdle() {
            assertThrows(NoActiveSessionException.class, () -> fx.lifecycle.end());
        }

        @Test
        @DisplayName("a completed instance can host a new session")
        void restartAfterCompleted() {
            fx.orchestrator.initialize(UserProfile.of("user-1"));
            Session first = fx.lifecycle.start(OrchestratorFixture.config(true));
            fx.lifecycle.end();
            assertEquals(LifecycleState.COMPLETED, fx.state.lifecycle());
            assertThrows(NoActiveSessionException.class, () -> fx.lifecycle.end());

            Session second = fx.lifecycle.start(OrchestratorFixture.config(true));

            assertNotEquals(first.id(), second.id());
            assertEquals(LifecycleState.ACTIVE, fx.state.lifecycle());
            assertTrue(fx.state.history().isEmpty());
        }

        @Test
        @DisplayName("start arms collectors and the tick loop")
        void startArms() {
            fx.orchestrator.initialize(UserProfile.of("user-1"));
            Session s = fx.lifecycle.start(OrchestratorFixture.config(true));

            assertEquals(SessionStatus.ACTIVE, s.status());
            assertEquals("user-1", s.userId());
            assertTrue(fx.state.ticksArmed());
            fx.collectorList.forEach(c -> assertTrue(c.isCollecting(), c.collectorName()));
        }
    }

    // ── end ───────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("end")
    class End {

        @BeforeEach
        void init() {
            fx.orchestrator.initialize(UserProfile.of("user-1"));
        }

        @Test
        @DisplayName("zero-event session yields a no-data final analysis")
        void zeroEvents() {
            fx.lifecycle.start(OrchestratorFixture.config(true));

            SessionReport report = fx.lifecycle.end();

            IntegratedAnalysis fin = report.finalIntegratedAnalysis();
            assertEquals(0.0, fin.overallScore());
            assertEquals(0.0, fin.confidenceScore());
            assertTrue(fin.insights().stream().anyMatch(i -> i.type().equals(IntegratedAnalysis.NO_DATA)));
            assertTrue(report.history().isEmpty());
            assertEquals(SessionStatus.COMPLETED, report.session().status());
            assertNotNull(report.session().endTime());
            assertEquals(0.0, report.outcome().overallWellbeing());
        }

        @Test
        @DisplayName("final pass runs every unit over the terminal summaries")
        void finalPass() {
            fx.lifecycle.start(OrchestratorFixture.config(false));
            for (int i = 0; i < 5; i++) {
                fx.realtime.process(InteractionEvent.of("interaction",
                    Map.of("performance", 0.5 + i * 0.1, "engagementLevel", 0.7)));
            }

            SessionReport report = fx.lifecycle.end();

            IntegratedAnalysis fin = report.finalIntegratedAnalysis();
            assertEquals(13, fin.algorithmScores().size());
            assertEquals(2, fin.familyScores().size());
            assertEquals(5, report.summaries().get(AlgorithmFamily.EMOTIONAL).totalEvents());
            assertEquals(5, report.summaries().get(AlgorithmFamily.NEUROPLASTICITY).totalEvents());
            assertTrue(report.outcome().overallWellbeing() > 0.0);
            fx.collectorList.forEach(c -> assertFalse(c.isCollecting(), c.collectorName()));
        }

        @Test
        @DisplayName("events after end are ignored")
        void eventsAfterEnd() {
            fx.lifecycle.start(OrchestratorFixture.config(true));
            fx.lifecycle.end();

            assertNull(fx.realtime.process(InteractionEvent.of("click", Map.of("frustrationLevel", 0.99))));
            assertNull(fx.state.latestRealtime());
        }
    }

    // ── end during a real-time pass ───────────────────────────────────────────

    @Nested
    @DisplayName("end during a real-time pass")
    class EndDuringRealtimePass {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final ExecutorService pool = Executors.newFixedThreadPool(2);

        @BeforeEach
        void init() {
            // Holds a real-time pass after it has read the buffer, until released.
            EmotionalDataCollector held = new EmotionalDataCollector(10) {
                @Override
                public List<InteractionEvent> recentEvents() {
                    List<InteractionEvent> events = super.recentEvents();
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return events;
                }
            };
            fx = new OrchestratorFixture(List.of(held, new NeuroplasticityDataCollector(10)), null);
            fx.orchestrator.initialize(UserProfile.of("user-1"));
            fx.lifecycle.start(OrchestratorFixture.config(true));
        }

        @AfterEach
        void shutdown() {
            release.countDown();
            pool.shutdownNow();
        }

        @Test
        @DisplayName("end waits for the in-flight pass and its intervention is kept")
        void endWaitsForPass() throws Exception {
            Future<IntegratedAnalysis> pass = pool.submit(() ->
                fx.realtime.process(InteractionEvent.of("click", Map.of("frustrationLevel", 0.85))));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Future<SessionReport> ending = pool.submit(() -> fx.lifecycle.end());
            Thread.sleep(200);
            assertFalse(ending.isDone());
            assertEquals(LifecycleState.ACTIVE, fx.state.lifecycle());

            // admission is closed while draining
            assertNull(fx.realtime.process(InteractionEvent.of("click", Map.of("frustrationLevel", 0.9))));

            release.countDown();
            IntegratedAnalysis analysis = pass.get(5, TimeUnit.SECONDS);
            SessionReport report = ending.get(5, TimeUnit.SECONDS);

            assertNotNull(analysis);
            assertSame(analysis, fx.state.latestRealtime());
            List<QueueItem> interventions = fx.queues.peekAll(QueueKind.INTERVENTION);
            assertEquals(1, interventions.size());
            assertEquals(QueuePriority.IMMEDIATE, interventions.get(0).priority());
            assertEquals(SessionStatus.COMPLETED, report.session().status());
            assertFalse(fx.state.isAnalyzing());
        }

        @Test
        @DisplayName("a pass outlasting the drain wait still queues its intervention")
        void passOutlastsDrain() throws Exception {
            Future<IntegratedAnalysis> pass = pool.submit(() ->
                fx.realtime.process(InteractionEvent.of("click", Map.of("frustrationLevel", 0.85))));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            SessionReport report = fx.lifecycle.end();
            assertEquals(LifecycleState.COMPLETED, fx.state.lifecycle());

            release.countDown();
            IntegratedAnalysis analysis = pass.get(5, TimeUnit.SECONDS);

            assertNotNull(analysis);
            assertEquals(SessionStatus.COMPLETED, report.session().status());
            List<QueueItem> interventions = fx.queues.peekAll(QueueKind.INTERVENTION);
            assertEquals(1, interventions.size());
            assertEquals(report.session().id(), interventions.get(0).sessionId());
        }
    }

    // ── collector failures ────────────────────────────────────────────────────

    @Test
    @DisplayName("a failing collector degrades its family without aborting the session")
    void collectorFailure() {
        DataCollectorAdapter broken = mock(DataCollectorAdapter.class);
        when(broken.family()).thenReturn(AlgorithmFamily.NEUROPLASTICITY);
        when(broken.collectorName()).thenReturn("BrokenCollector");
        when(broken.collect(any())).thenThrow(
            new CollectorUnavailableException(AlgorithmFamily.NEUROPLASTICITY, "sensor offline"));
        when(broken.stopCollection()).thenThrow(
            new CollectorUnavailableException(AlgorithmFamily.NEUROPLASTICITY, "sensor offline"));

        fx = new OrchestratorFixture(List.of(new EmotionalDataCollector(10), broken), null);
        fx.orchestrator.initialize(UserProfile.of("user-1"));
        fx.lifecycle.start(OrchestratorFixture.config(true));

        IntegratedAnalysis realtime = fx.realtime.process(
            InteractionEvent.of("click", Map.of("engagementLevel", 0.6)));
        SessionReport report = fx.lifecycle.end();

        assertNotNull(realtime);
        assertTrue(realtime.degraded());
        assertEquals(Set.of(AlgorithmFamily.NEUROPLASTICITY), fx.state.degradedFamilies());

        IntegratedAnalysis fin = report.finalIntegratedAnalysis();
        assertTrue(fin.degraded());
        assertTrue(fin.insights().stream().anyMatch(i -> i.type().equals(DualFamilyAnalyzer.COLLECTOR_UNAVAILABLE)));
        assertEquals(Set.of(AlgorithmFamily.EMOTIONAL), fin.familyScores().keySet());
        assertEquals(0, report.summaries().get(AlgorithmFamily.NEUROPLASTICITY).totalEvents());
    }
}
