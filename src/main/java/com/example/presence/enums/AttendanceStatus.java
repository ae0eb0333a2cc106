package com.example.presence.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one presence check.
 *
 * PRESENT: inside a geofence during an active window.
 * LATE: outside every geofence, but confirmed manually during an active window.
 * ABSENT: no active time window at the check timestamp.
 * OUTSIDE: outside every geofence, reported automatically during an active window.
 */
public enum AttendanceStatus {
    PRESENT,
    LATE,
    ABSENT,
    OUTSIDE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AttendanceStatus fromWire(String value) {
        if (value == null) return null;
        return AttendanceStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
