package com.example.presence.geo;

import com.example.presence.model.Coordinate;

import java.util.List;

/**
 * Gnomonic projection onto the plane tangent to the sphere at the centre of a ring.
 *
 * Great circles project to straight lines, so a planar point-in-polygon test on the
 * projected ring is exact for a ring whose edges are great-circle arcs. Only the
 * hemisphere around the centre can be projected.
 */
final class GnomonicProjection {

    // vertices must stay within 85° of the centre to keep the projection well conditioned
    static final double MIN_VERTEX_COS = Math.cos(Math.toRadians(85));

    private final double[] centre;
    private final double[] east;
    private final double[] north;

    private GnomonicProjection(double[] centre) {
        this.centre = centre;
        double[] axis = Math.abs(centre[2]) < 0.99 ? new double[]{0, 0, 1} : new double[]{1, 0, 0};
        this.east = normalize(cross(axis, centre));
        this.north = cross(centre, east);
    }

    /**
     * Centred on the normalized mean of the ring vertices (closing vertex excluded).
     *
     * @throws IllegalArgumentException when the ring does not fit in one hemisphere
     */
    static GnomonicProjection centredOn(List<Coordinate> ring) {
        double[] sum = new double[3];
        for (int i = 0; i < ring.size() - 1; i++) {
            double[] v = GeodesicMath.toUnitVector(ring.get(i).getLatitude(), ring.get(i).getLongitude());
            sum[0] += v[0];
            sum[1] += v[1];
            sum[2] += v[2];
        }
        if (norm(sum) < 1e-9) {
            throw new IllegalArgumentException("ring has no well-defined centre");
        }
        GnomonicProjection projection = new GnomonicProjection(normalize(sum));
        for (Coordinate vertex : ring) {
            if (projection.cosineToCentre(vertex) < MIN_VERTEX_COS) {
                throw new IllegalArgumentException("ring does not fit in one hemisphere");
            }
        }
        return projection;
    }

    /**
     * Cosine of the angular distance between the point and the projection centre.
     */
    double cosineToCentre(Coordinate c) {
        return dot(GeodesicMath.toUnitVector(c.getLatitude(), c.getLongitude()), centre);
    }

    boolean canProject(Coordinate c) {
        return cosineToCentre(c) > 0;
    }

    org.locationtech.jts.geom.Coordinate project(Coordinate c) {
        double[] p = GeodesicMath.toUnitVector(c.getLatitude(), c.getLongitude());
        double d = dot(p, centre);
        return new org.locationtech.jts.geom.Coordinate(dot(p, east) / d, dot(p, north) / d);
    }

    private static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    private static double[] cross(double[] a, double[] b) {
        return new double[]{
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]};
    }

    private static double norm(double[] v) {
        return Math.sqrt(dot(v, v));
    }

    private static double[] normalize(double[] v) {
        double n = norm(v);
        return new double[]{v[0] / n, v[1] / n, v[2] / n};
    }
}
