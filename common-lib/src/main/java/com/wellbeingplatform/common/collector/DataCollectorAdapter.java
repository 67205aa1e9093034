package com.wellbeingplatform.common.collector;

import com.wellbeingplatform.common.exception.CollectorUnavailableException;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import com.wellbeingplatform.common.model.CollectorSummary;
import com.wellbeingplatform.common.model.InteractionEvent;

import java.util.List;

/**
 * Contract of a Data Collector source feeding one algorithm family.
 *
 * <p>The orchestrator drives the collector through one session at a time:
 * {@code startCollection → collect* → stopCollection}. Any method may fail with
 * {@link CollectorUnavailableException}; callers absorb the failure and flag the
 * family's data as low-confidence.
 *
 * <p>Implementations must tolerate concurrent {@link #collect} and
 * {@link #recentEvents} calls.
 */
public interface DataCollectorAdapter {

    String collectorName();

    AlgorithmFamily family();

    void startCollection(String sessionId, String userId);

    /**
     * Buffers one event. Events offered while not collecting are ignored.
     *
     * @return {@code true} if the event was buffered
     */
    boolean collect(InteractionEvent event);

    /** Copy of the rolling buffer, oldest first. */
    List<InteractionEvent> recentEvents();

    /** Summary of everything collected so far, without stopping. */
    CollectorSummary currentSummary();

    /** Stops collecting and returns the terminal summary. */
    CollectorSummary stopCollection();

    boolean isCollecting();
}
