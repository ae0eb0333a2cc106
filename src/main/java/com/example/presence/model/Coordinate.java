package com.example.presence.model;

import lombok.Value;

/**
 * WGS84 position reported by a caller. Accuracy is the optional GPS accuracy radius in meters.
 */
@Value
public class Coordinate {

    double latitude;
    double longitude;
    Double accuracyMeters;

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude, null);
    }

    public static Coordinate of(double latitude, double longitude, Double accuracyMeters) {
        return new Coordinate(latitude, longitude, accuracyMeters);
    }

    public boolean isWithinRange() {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }

    /**
     * Same point on the globe: longitudes -180 and 180 are the same meridian.
     */
    public boolean sameLocation(Coordinate other) {
        return other != null
                && Double.compare(latitude, other.latitude) == 0
                && Double.compare(normalizedLongitude(longitude), normalizedLongitude(other.longitude)) == 0;
    }

    private static double normalizedLongitude(double lon) {
        return lon == -180.0 ? 180.0 : lon;
    }
}
