package com.example.presence.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of a geofence as used by one decision.
 * The ring is kept as stored; it is validated when evaluated.
 */
@Value
@Builder
public class GeofenceRule {

    Long id;
    String name;
    List<Coordinate> ring;
    double marginMeters;
    boolean active;
}
