package com.wellbeingplatform.orchestrator.pipeline;

import com.wellbeingplatform.common.collector.DataCollectorAdapter;
import com.wellbeingplatform.common.model.AlgorithmFamily;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** The Data Collector Adapters of the running instance, one per family. */
@Component
public class FamilyCollectors {

    private final Map<AlgorithmFamily, DataCollectorAdapter> byFamily = new EnumMap<>(AlgorithmFamily.class);

    public FamilyCollectors(List<DataCollectorAdapter> collectors) {
        for (DataCollectorAdapter collector : collectors) {
            DataCollectorAdapter previous = byFamily.putIfAbsent(collector.family(), collector);
            if (previous != null) {
                throw new IllegalArgumentException("Two collectors for family " + collector.family()
                    + ": " + previous.collectorName() + ", " + collector.collectorName());
            }
        }
    }

    /** Collectors in family declaration order. */
    public List<DataCollectorAdapter> all() {
        return new ArrayList<>(byFamily.values());
    }
}
