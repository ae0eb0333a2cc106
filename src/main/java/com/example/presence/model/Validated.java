package com.example.presence.model;

import com.example.presence.exception.InvalidInputException;

import java.util.Objects;

/**
 * Outcome of an input validation: either a value or an error message.
 */
public final class Validated<T> {

    private final T value;
    private final String error;

    private Validated(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Validated<T> ok(T value) {
        return new Validated<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Validated<T> invalid(String error) {
        return new Validated<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isValid() {
        return error == null;
    }

    public T getValue() {
        if (!isValid()) {
            throw new IllegalStateException("No value present: " + error);
        }
        return value;
    }

    public String getError() {
        return error;
    }

    public T orElseThrow() {
        if (!isValid()) {
            throw new InvalidInputException(error);
        }
        return value;
    }
}
