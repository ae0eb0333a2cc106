package com.example.presence.exception;

import com.example.presence.enums.ErrorKind;
import com.example.presence.model.Decision;

/**
 * The decision was computed but the event could not be persisted.
 * Carries the decision so the caller can report it and retry recording.
 */
public class RecorderFailureException extends PresenceException {

    private final transient Decision decision;

    public RecorderFailureException(Decision decision, Throwable cause) {
        super(ErrorKind.RECORDER_FAILURE,
                "Decision '" + decision.getStatus().wireValue() + "' computed but the event could not be recorded",
                cause);
        this.decision = decision;
    }

    public Decision getDecision() {
        return decision;
    }
}
