package com.example.presence.geo;

import com.example.presence.exception.InvalidGeometryException;
import com.example.presence.model.Coordinate;
import com.example.presence.model.GeofenceRule;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Point-in-geofence test with an outward margin, on a spherical Earth.
 *
 * Ring edges are great-circle arcs. The ring and the point are projected gnomonically
 * around the ring centre, where great circles become straight lines, and JTS tests
 * containment there (boundary included). A point outside the ring is still contained
 * when its great-circle distance to the nearest edge is at most the geofence margin.
 *
 * When several geofences are active, they are tried smallest margin first, then by id,
 * and the first containing one wins.
 */
@Component
public class GeofenceEvaluator {

    public static final int MIN_RING_VERTICES = 4;

    // absorbs rounding between the projected ring and the geodesic edge distance
    static final double BOUNDARY_TOLERANCE_M = 0.01;

    static final Comparator<GeofenceRule> PRIORITY = Comparator
            .comparingDouble(GeofenceRule::getMarginMeters)
            .thenComparing(GeofenceRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Logger log = LoggerFactory.getLogger(GeofenceEvaluator.class);

    private final GeometryFactory geometryFactory = new GeometryFactory();

    public boolean contains(GeofenceRule geofence, Coordinate point) {
        ProjectedRing shape = project(geofence.getRing(), storedFailure(geofence));

        GnomonicProjection projection = shape.projection;
        if (projection.canProject(point)) {
            Point projected = geometryFactory.createPoint(projection.project(point));
            if (shape.polygon.covers(projected)) {
                return true;
            }
        }
        double margin = geofence.getMarginMeters();
        double distance = distanceToRingMeters(geofence.getRing(), point);
        log.trace("geofence id={} distance={}m margin={}m", geofence.getId(), distance, margin);
        return distance <= margin + BOUNDARY_TOLERANCE_M;
    }

    /**
     * First active geofence containing the point, by priority order.
     */
    public Optional<GeofenceRule> firstContaining(List<GeofenceRule> geofences, Coordinate point) {
        if (geofences == null || geofences.isEmpty()) {
            return Optional.empty();
        }
        return geofences.stream()
                .filter(GeofenceRule::isActive)
                .sorted(PRIORITY)
                .filter(g -> contains(g, point))
                .findFirst();
    }

    /**
     * Validates a polygon submitted for storage.
     */
    public void validateSubmission(List<Coordinate> ring) {
        project(ring, InvalidGeometryException::forSubmission);
    }

    /**
     * Validates a stored geofence; failures are reported against its id.
     */
    public void validateStored(GeofenceRule geofence) {
        project(geofence.getRing(), storedFailure(geofence));
    }

    public double distanceToRingMeters(List<Coordinate> ring, Coordinate point) {
        double min = Double.MAX_VALUE;
        for (int i = 0; i < ring.size() - 1; i++) {
            Coordinate a = ring.get(i);
            Coordinate b = ring.get(i + 1);
            double d = GeodesicMath.distanceToSegmentMeters(
                    point.getLatitude(), point.getLongitude(),
                    a.getLatitude(), a.getLongitude(),
                    b.getLatitude(), b.getLongitude());
            min = Math.min(min, d);
        }
        return min;
    }

    private static Function<String, InvalidGeometryException> storedFailure(GeofenceRule geofence) {
        return reason -> InvalidGeometryException.forStoredGeofence(geofence.getId(), reason);
    }

    private ProjectedRing project(List<Coordinate> ring, Function<String, InvalidGeometryException> failure) {
        if (ring == null || ring.size() < MIN_RING_VERTICES) {
            throw failure.apply("ring must have at least " + MIN_RING_VERTICES + " vertices, found "
                    + (ring == null ? 0 : ring.size()));
        }
        if (!ring.get(0).sameLocation(ring.get(ring.size() - 1))) {
            throw failure.apply("ring is not closed (first vertex differs from last)");
        }
        for (Coordinate vertex : ring) {
            if (vertex == null || !vertex.isWithinRange()) {
                throw failure.apply("vertex out of WGS84 range: " + vertex);
            }
        }

        GnomonicProjection projection;
        try {
            projection = GnomonicProjection.centredOn(ring);
        } catch (IllegalArgumentException ex) {
            throw failure.apply(ex.getMessage());
        }
        org.locationtech.jts.geom.Coordinate[] coordinates = ring.stream()
                .map(projection::project)
                .toArray(org.locationtech.jts.geom.Coordinate[]::new);
        // the closing vertex must be bit-identical for JTS
        coordinates[coordinates.length - 1] = new org.locationtech.jts.geom.Coordinate(coordinates[0]);
        LinearRing shell;
        try {
            shell = geometryFactory.createLinearRing(coordinates);
        } catch (IllegalArgumentException ex) {
            throw failure.apply(ex.getMessage());
        }
        if (!shell.isSimple()) {
            throw failure.apply("ring self-intersects");
        }
        Polygon polygon = geometryFactory.createPolygon(shell);
        if (polygon.getArea() == 0.0) {
            throw failure.apply("ring encloses no area");
        }
        return new ProjectedRing(projection, polygon);
    }

    private static final class ProjectedRing {
        private final GnomonicProjection projection;
        private final Polygon polygon;

        private ProjectedRing(GnomonicProjection projection, Polygon polygon) {
            this.projection = projection;
            this.polygon = polygon;
        }
    }
}
