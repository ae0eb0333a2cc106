package com.example.presence.exception;

import com.example.presence.enums.ErrorKind;

/**
 * Base class for every failure the service reports to its callers.
 */
public abstract class PresenceException extends RuntimeException {

    private final ErrorKind kind;

    protected PresenceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PresenceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
