package com.wellbeingplatform.common.exception;

import com.wellbeingplatform.common.model.LifecycleState;

/** An operation was attempted from the wrong lifecycle state. */
public class InvalidStateException extends AnalysisException {
    private final LifecycleState state;

    public InvalidStateException(LifecycleState state, String message) {
        super(message + " (state=" + state + ")");
        this.state = state;
    }

    public LifecycleState getState() {
        return state;
    }
}
