package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.common.model.CollectorSummary;
import com.wellbeingplatform.common.model.InteractionEvent;
import com.wellbeingplatform.common.model.Session;
import com.wellbeingplatform.common.model.SessionData;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;

/**
 * Builds the {@link SessionData} an Algorithm Unit reads.
 * <ul>
 *   <li>{@link #forWindow}: metrics derived from the events in scope only</li>
 *   <li>{@link #forSummary}: metrics taken from a collector's terminal summary, no events</li>
 * </ul>
 */
public final class SessionDataAssembler {

    private SessionDataAssembler() {}

    public static SessionData forWindow(Session session, List<InteractionEvent> events, CollectorSummary summary) {
        Map<String, Double> metrics = EventTally.over(events).metrics();
        return new SessionData(session.id(), session.userId(), activity(session), difficulty(session),
            events, summary, metrics);
    }

    public static SessionData forSummary(Session session, CollectorSummary summary) {
        Map<String, Double> metrics = new LinkedHashMap<>(summary.metrics());
        summary.counts().forEach((name, count) -> metrics.put(name, count.doubleValue()));
        metrics.put(EVENT_COUNT, (double) summary.totalEvents());
        metrics.put(ERROR_COUNT, (double) summary.errorCount());
        metrics.put(ERROR_RATE, summary.totalEvents() == 0 ? 0.0 : (double) summary.errorCount() / summary.totalEvents());
        metrics.put(TIME_SPENT_MS, (double) summary.durationMs());
        return new SessionData(session.id(), session.userId(), activity(session), difficulty(session),
            List.of(), summary, metrics);
    }

    private static String activity(Session session) {
        return session.config() == null ? null : session.config().activityType();
    }

    private static String difficulty(Session session) {
        return session.config() == null ? null : session.config().difficulty();
    }
}
