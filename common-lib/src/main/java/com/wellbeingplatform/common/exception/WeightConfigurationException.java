package com.wellbeingplatform.common.exception;

/** A weight table could not be validated or normalised at construction time. */
public class WeightConfigurationException extends AnalysisException {

    public WeightConfigurationException(String message) {
        super(message);
    }
}
