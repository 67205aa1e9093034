package com.wellbeingplatform.common.exception;

public class NoActiveSessionException extends AnalysisException {

    public NoActiveSessionException(String message) {
        super(message);
    }
}
