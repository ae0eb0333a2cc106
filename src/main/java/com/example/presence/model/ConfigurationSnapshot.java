package com.example.presence.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Geofences and time windows as seen by one decision call.
 */
@Value
public class ConfigurationSnapshot {

    List<GeofenceRule> geofences;
    List<TimeWindowRule> timeWindows;
    Instant loadedAt;

    public static ConfigurationSnapshot of(List<GeofenceRule> geofences, List<TimeWindowRule> timeWindows, Instant loadedAt) {
        return new ConfigurationSnapshot(List.copyOf(geofences), List.copyOf(timeWindows), loadedAt);
    }
}
