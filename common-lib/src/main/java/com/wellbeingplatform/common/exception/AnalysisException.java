package com.wellbeingplatform.common.exception;

/**
 * Root of the analysis error taxonomy. All subclasses are unchecked.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
