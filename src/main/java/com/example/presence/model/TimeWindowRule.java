package com.example.presence.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;

/**
 * Read-only view of a permitted time-of-day interval.
 */
@Value
@Builder
public class TimeWindowRule {

    Long id;
    String name;
    LocalTime startTime;
    LocalTime endTime;
    boolean active;

    /**
     * Inclusive on both ends. Windows never wrap midnight, so start is always before end.
     */
    public boolean covers(LocalTime timeOfDay) {
        return !timeOfDay.isBefore(startTime) && !timeOfDay.isAfter(endTime);
    }
}
