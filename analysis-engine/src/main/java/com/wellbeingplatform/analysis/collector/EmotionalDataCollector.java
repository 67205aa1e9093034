package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;

/** Behavioural signals: click bursts, hesitations, backtracking, help-seeking, colour choices. */
@Component
public class EmotionalDataCollector extends BufferedDataCollector {

    private static final Set<String> COUNTS = Set.of(
        HELP_REQUESTS, RETRY_ATTEMPTS, CLICK_BURSTS, HESITATIONS, BACKTRACKS,
        WARM_COLORS, COOL_COLORS, DARK_COLORS, DISTINCT_COLORS, DISTINCT_EVENT_TYPES);

    private static final Set<String> METRICS = Set.of(
        EVENT_COUNT, ERROR_COUNT, ERROR_RATE, TIME_SPENT_MS, EVENTS_PER_SECOND);

    public EmotionalDataCollector(@Value("${analysis.collector.buffer-size:100}") int bufferSize) {
        super(bufferSize);
    }

    @Override
    public String collectorName() { return "EmotionalDataCollector"; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.EMOTIONAL; }

    @Override
    protected Set<String> reportedCounts() { return COUNTS; }

    @Override
    protected Set<String> reportedMetrics() { return METRICS; }
}
