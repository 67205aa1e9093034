package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.common.model.CollectorSummary;
import com.wellbeingplatform.common.model.InteractionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EmotionalDataCollectorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    private EmotionalDataCollector collector;

    @BeforeEach
    void setUp() {
        collector = new EmotionalDataCollector(3);
    }

    private static InteractionEvent click(long offsetMs) {
        return InteractionEvent.of("click", T0.plusMillis(offsetMs), Map.of());
    }

    @Nested
    @DisplayName("collection window")
    class Window {

        @Test
        @DisplayName("events offered before start are ignored")
        void ignoredBeforeStart() {
            assertFalse(collector.collect(click(0)));
            assertTrue(collector.recentEvents().isEmpty());
        }

        @Test
        @DisplayName("rolling buffer keeps only the newest events")
        void rollingBuffer() {
            collector.startCollection("s-1", "u-1");
            for (int i = 0; i < 5; i++) {
                collector.collect(click(i * 1000L));
            }

            assertEquals(3, collector.recentEvents().size());
            assertEquals(T0.plusMillis(2000), collector.recentEvents().get(0).timestamp());
            assertEquals(5, collector.currentSummary().totalEvents());
        }

        @Test
        @DisplayName("events offered after stop are ignored")
        void ignoredAfterStop() {
            collector.startCollection("s-1", "u-1");
            collector.collect(click(0));
            collector.stopCollection();

            assertFalse(collector.isCollecting());
            assertFalse(collector.collect(click(10)));
        }

        @Test
        @DisplayName("restart resets the session statistics")
        void restartResets() {
            collector.startCollection("s-1", "u-1");
            collector.collect(click(0));
            collector.stopCollection();
            collector.startCollection("s-2", "u-1");

            CollectorSummary summary = collector.currentSummary();
            assertEquals("s-2", summary.sessionId());
            assertEquals(0, summary.totalEvents());
        }
    }

    @Nested
    @DisplayName("terminal summary")
    class Summary {

        @Test
        @DisplayName("counts bursts, hesitations, help, errors and colours")
        void tallies() {
            collector.startCollection("s-1", "u-1");
            collector.collect(click(0));
            collector.collect(click(100));                               // burst
            collector.collect(InteractionEvent.of("pause", T0.plusMillis(5000), Map.of("pauseDuration", 4000)));
            collector.collect(InteractionEvent.of("help", T0.plusMillis(6000), Map.of()));
            collector.collect(InteractionEvent.of("error", T0.plusMillis(7000), Map.of("error", true)));
            collector.collect(InteractionEvent.of("paint", T0.plusMillis(8000), Map.of("color", "red")));
            collector.collect(InteractionEvent.of("paint", T0.plusMillis(9000), Map.of("color", "#101010")));

            CollectorSummary s = collector.stopCollection();

            assertEquals(7, s.totalEvents());
            assertEquals(1, s.errorCount());
            assertEquals(9000, s.durationMs());
            assertEquals(1500.0, s.avgIntervalMs(), 1e-9);
            assertEquals(1, s.count(SessionMetrics.CLICK_BURSTS));
            assertEquals(1, s.count(SessionMetrics.HESITATIONS));
            assertEquals(1, s.count(SessionMetrics.HELP_REQUESTS));
            assertEquals(1, s.count(SessionMetrics.WARM_COLORS));
            assertEquals(1, s.count(SessionMetrics.DARK_COLORS));
            assertEquals(4000.0, s.metrics().get(SessionMetrics.PAUSE_DURATION), 1e-9);
        }

        @Test
        @DisplayName("neuroplasticity counts are not reported by the emotional collector")
        void familyScopedCounts() {
            collector.startCollection("s-1", "u-1");
            collector.collect(click(0));
            assertFalse(collector.currentSummary().counts().containsKey(SessionMetrics.IMPROVEMENTS));
        }
    }
}
