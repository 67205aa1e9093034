package com.wellbeingplatform.common.exception;

import com.wellbeingplatform.common.model.AlgorithmFamily;

/**
 * A Data Collector Adapter failed to supply data. The affected family's pass still runs
 * on whatever data exists and is flagged low-confidence.
 */
public class CollectorUnavailableException extends AnalysisException {
    private final AlgorithmFamily family;

    public CollectorUnavailableException(AlgorithmFamily family, String message) {
        super("[" + family + "] " + message);
        this.family = family;
    }

    public CollectorUnavailableException(AlgorithmFamily family, String message, Throwable cause) {
        super("[" + family + "] " + message, cause);
        this.family = family;
    }

    public AlgorithmFamily getFamily() {
        return family;
    }
}
