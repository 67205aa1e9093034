package com.wellbeingplatform.analysis.collector;

import com.wellbeingplatform.common.model.AlgorithmFamily;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.wellbeingplatform.analysis.collector.SessionMetrics.*;

/** Learning signals: performance series and its improvement, cognitive load, retries, errors. */
@Component
public class NeuroplasticityDataCollector extends BufferedDataCollector {

    private static final Set<String> COUNTS = Set.of(HELP_REQUESTS, RETRY_ATTEMPTS, IMPROVEMENTS);

    private static final Set<String> METRICS = Set.of(
        EVENT_COUNT, ERROR_COUNT, ERROR_RATE, TIME_SPENT_MS, PERFORMANCE_TREND);

    public NeuroplasticityDataCollector(@Value("${analysis.collector.buffer-size:100}") int bufferSize) {
        super(bufferSize);
    }

    @Override
    public String collectorName() { return "NeuroplasticityDataCollector"; }

    @Override
    public AlgorithmFamily family() { return AlgorithmFamily.NEUROPLASTICITY; }

    @Override
    protected Set<String> reportedCounts() { return COUNTS; }

    @Override
    protected Set<String> reportedMetrics() { return METRICS; }
}
