package com.wellbeingplatform.common.exception;

/**
 * Raised inside a single Algorithm Unit. The registry catches it per unit and never
 * lets it escape a pass.
 */
public class AlgorithmExecutionException extends AnalysisException {
    private final String algorithmName;

    public AlgorithmExecutionException(String algorithmName, String message) {
        super("[" + algorithmName + "] " + message);
        this.algorithmName = algorithmName;
    }

    public AlgorithmExecutionException(String algorithmName, String message, Throwable cause) {
        super("[" + algorithmName + "] " + message, cause);
        this.algorithmName = algorithmName;
    }

    public String getAlgorithmName() {
        return algorithmName;
    }
}
