package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.CollectorSummary;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionConfig;
import com.wellbeingplatform.common.model.SessionData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionDataAssemblerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");
    private static final Session SESSION = Session.start("s-1",
        SessionConfig.of("u-1", "drawing", "easy", 0, true), T0);

    @Test
    @DisplayName("window metrics are derived from the events in scope")
    void windowMetrics() {
        List<InteractionEvent> events = List.of(
            InteractionEvent.of("answer", T0, Map.of("responseTime", 1000, "engagementLevel", 0.2)),
            InteractionEvent.of("error", T0.plusSeconds(4), Map.of("responseTime", 3000, "error", true)));

        SessionData data = SessionDataAssembler.forWindow(SESSION, events, null);

        assertEquals("drawing", data.activityType());
        assertEquals(2.0, data.metricOr(SessionMetrics.EVENT_COUNT, 0));
        assertEquals(0.5, data.metricOr(SessionMetrics.ERROR_RATE, 0));
        assertEquals(2000.0, data.metricOr(SessionMetrics.RESPONSE_TIME, 0));
        assertEquals(4000.0, data.metricOr(SessionMetrics.TIME_SPENT_MS, 0));
        assertEquals(0.2, data.metricOr("engagementLevel", 0));
        assertFalse(data.isEmpty());
    }

    @Test
    @DisplayName("summary data carries no events but exposes counts as metrics")
    void summaryMetrics() {
        CollectorSummary summary = new CollectorSummary("EmotionalDataCollector", AlgorithmFamily.EMOTIONAL,
            "s-1", 10, 2, 60_000, 6_666.0, Map.of(SessionMetrics.HELP_REQUESTS, 3L),
            Map.of("engagementLevel", 0.7));

        SessionData data = SessionDataAssembler.forSummary(SESSION, summary);

        assertTrue(data.events().isEmpty());
        assertEquals(0.2, data.metricOr(SessionMetrics.ERROR_RATE, 0), 1e-9);
        assertEquals(3.0, data.metricOr(SessionMetrics.HELP_REQUESTS, 0));
        assertEquals(60_000.0, data.metricOr(SessionMetrics.TIME_SPENT_MS, 0));
        assertEquals(0.7, data.metricOr("engagementLevel", 0));
        assertFalse(data.isEmpty());
    }

    @Test
    @DisplayName("no events and an empty summary is empty data")
    void emptyData() {
        SessionData data = SessionDataAssembler.forSummary(SESSION,
            CollectorSummary.empty("EmotionalDataCollector", AlgorithmFamily.EMOTIONAL, "s-1"));
        assertTrue(data.isEmpty());
    }
}
