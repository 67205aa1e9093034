package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.common.collector.DataCollectorAdapter;
import com.wellbeingplatform.common.model.CollectorSummary;
import com.wellbeingplatform.common.model.InteractionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rolling-buffer collector: keeps the last {@code bufferSize} events for real-time
 * passes and an {@link EventTally} over the whole session for the terminal summary.
 * Subclasses choose which counts and metrics their family reports.
 */
public abstract class BufferedDataCollector implements DataCollectorAdapter {

    private static final Logger log = LoggerFactory.getLogger(BufferedDataCollector.class);

    private final int bufferSize;
    private final Deque<InteractionEvent> buffer = new ArrayDeque<>();

    private String sessionId;
    private boolean collecting;
    private EventTally tally = new EventTally();

    protected BufferedDataCollector(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /** Names from {@link EventTally#counts()} this collector reports. */
    protected abstract Set<String> reportedCounts();

    /** Metric names this collector reports beyond the per-field means. */
    protected abstract Set<String> reportedMetrics();

    @Override
    public synchronized void startCollection(String sessionId, String userId) {
        if (collecting) {
            log.warn("[{}] Restarting collection previousSession={} newSession={}",
                collectorName(), this.sessionId, sessionId);
        }
        this.sessionId  = sessionId;
        this.collecting = true;
        this.tally      = new EventTally();
        buffer.clear();
        log.info("[{}] Collection started session={} user={}", collectorName(), sessionId, userId);
    }

    @Override
    public synchronized boolean collect(InteractionEvent event) {
        if (!collecting || event == null) {
            return false;
        }
        buffer.addLast(event);
        while (buffer.size() > bufferSize) {
            buffer.removeFirst();
        }
        tally.accept(event);
        return true;
    }

    @Override
    public synchronized List<InteractionEvent> recentEvents() {
        return List.copyOf(buffer);
    }

    @Override
    public synchronized CollectorSummary currentSummary() {
        if (sessionId == null) {
            return CollectorSummary.empty(collectorName(), family(), null);
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        tally.counts().forEach((name, count) -> {
            if (reportedCounts().contains(name)) counts.put(name, count);
        });
        Map<String, Double> metrics = new LinkedHashMap<>(tally.fieldMeans());
        tally.metrics().forEach((name, value) -> {
            if (reportedMetrics().contains(name)) metrics.put(name, value);
        });
        return new CollectorSummary(collectorName(), family(), sessionId, tally.total(), tally.errors(),
            tally.durationMs(), tally.avgIntervalMs(), counts, metrics);
    }

    @Override
    public synchronized CollectorSummary stopCollection() {
        CollectorSummary summary = currentSummary();
        if (collecting) {
            log.info("[{}] Collection stopped session={} events={} errors={}",
                collectorName(), sessionId, summary.totalEvents(), summary.errorCount());
        }
        collecting = false;
        buffer.clear();
        return summary;
    }

    @Override
    public synchronized boolean isCollecting() {
        return collecting;
    }
}
