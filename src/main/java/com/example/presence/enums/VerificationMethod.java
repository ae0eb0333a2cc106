package com.example.presence.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the reported coordinate was obtained.
 * AUTO is device-reported, MANUAL is a human-confirmed override.
 */
public enum VerificationMethod {
    AUTO,
    MANUAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VerificationMethod fromWire(String value) {
        if (value == null) return null;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // "automatic" is accepted as an alias of auto
        if ("AUTOMATIC".equals(normalized)) return AUTO;
        return VerificationMethod.valueOf(normalized);
    }
}
