package com.example.presence.geo;

/**
 * Great-circle helpers on a spherical Earth (mean radius, IUGG).
 * All angles in degrees on input, distances in meters on output.
 */
public final class GeodesicMath {

    public static final double EARTH_RADIUS_M = 6_371_008.8;

    private GeodesicMath() {
    }

    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        return EARTH_RADIUS_M * centralAngle(lat1, lon1, lat2, lon2);
    }

    /**
     * Shortest distance from point P to the great-circle segment A-B.
     * Uses cross-track distance when the foot of the perpendicular falls on the segment,
     * otherwise the distance to the nearer endpoint.
     */
    public static double distanceToSegmentMeters(double pLat, double pLon,
                                                 double aLat, double aLon,
                                                 double bLat, double bLon) {
        double d13 = centralAngle(aLat, aLon, pLat, pLon);
        if (d13 == 0.0) return 0.0;
        double d12 = centralAngle(aLat, aLon, bLat, bLon);
        if (d12 == 0.0) return EARTH_RADIUS_M * d13;

        double theta13 = initialBearing(aLat, aLon, pLat, pLon);
        double theta12 = initialBearing(aLat, aLon, bLat, bLon);
        double delta = theta13 - theta12;

        // P lies behind A relative to the segment direction
        if (Math.cos(delta) < 0) {
            return EARTH_RADIUS_M * d13;
        }

        double dxt = Math.asin(clamp(Math.sin(d13) * Math.sin(delta)));
        double dat = Math.acos(clamp(Math.cos(d13) / Math.cos(dxt)));
        if (dat > d12) {
            return haversineMeters(bLat, bLon, pLat, pLon);
        }
        return EARTH_RADIUS_M * Math.abs(dxt);
    }

    /**
     * Earth-centred unit vector (x towards 0°E on the equator, z towards the north pole).
     * Longitudes either side of ±180 map to the same vector.
     */
    static double[] toUnitVector(double lat, double lon) {
        double phi = Math.toRadians(lat);
        double lambda = Math.toRadians(lon);
        return new double[]{
                Math.cos(phi) * Math.cos(lambda),
                Math.cos(phi) * Math.sin(lambda),
                Math.sin(phi)};
    }

    // radians
    static double centralAngle(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    // radians
    static double initialBearing(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dLambda = Math.toRadians(lon2 - lon1);
        double y = Math.sin(dLambda) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLambda);
        return Math.atan2(y, x);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
