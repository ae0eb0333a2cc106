package com.example.presence.enums;

/**
 * Error taxonomy returned to callers next to the HTTP status.
 */
public enum ErrorKind {
    INVALID_INPUT("InvalidInput"),
    INVALID_GEOMETRY("InvalidGeometry"),
    RECORDER_FAILURE("RecorderFailure"),
    NOT_FOUND("NotFound"),
    CONFLICT("Conflict");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
