package com.example.presence.geo;

import com.example.presence.exception.InvalidGeometryException;
import com.example.presence.model.Coordinate;
import com.example.presence.model.GeofenceRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.presence.CampusFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GeofenceEvaluator")
class GeofenceEvaluatorTest {

    private final GeofenceEvaluator evaluator = new GeofenceEvaluator();

    @Nested
    @DisplayName("contains")
    class Contains {

        @Test
        @DisplayName("Point inside the ring is contained without margin")
        void insideWithoutMargin() {
            assertThat(evaluator.contains(campus(1L, 0), CENTER)).isTrue();
        }

        @Test
        @DisplayName("Vertex and edge points are contained")
        void boundaryIsInclusive() {
            assertThat(evaluator.contains(campus(1L, 0), Coordinate.of(SOUTH, WEST))).isTrue();
            assertThat(evaluator.contains(campus(1L, 0), Coordinate.of(SOUTH, 2.3527))).isTrue();
        }

        @Test
        @DisplayName("Point 30 m outside is contained only thanks to a 50 m margin")
        void withinMargin() {
            assertThat(evaluator.contains(campus(1L, 50), SOUTH_30M)).isTrue();
            assertThat(evaluator.contains(campus(1L, 0), SOUTH_30M)).isFalse();
            assertThat(evaluator.contains(campus(1L, 20), SOUTH_30M)).isFalse();
        }

        @Test
        @DisplayName("Point 200 m outside is not contained with a 50 m margin")
        void beyondMargin() {
            assertThat(evaluator.contains(campus(1L, 50), SOUTH_200M)).isFalse();
        }

        @Test
        @DisplayName("Edges of a large ring follow great circles, not parallels")
        void largeRingUsesGreatCircleEdges() {
            // the southern edge between 60°N 30°W and 60°N 30°E peaks near 63.4°N,
            // the northern edge between 70°N 30°W and 70°N 30°E near 72.5°N
            GeofenceRule large = rule(11L, List.of(
                    Coordinate.of(60, -30), Coordinate.of(60, 30), Coordinate.of(70, 30),
                    Coordinate.of(70, -30), Coordinate.of(60, -30)));

            assertThat(evaluator.contains(large, Coordinate.of(61, 0))).isFalse();
            assertThat(evaluator.contains(large, Coordinate.of(64, 0))).isTrue();
            assertThat(evaluator.contains(large, Coordinate.of(71, 0))).isTrue();
        }

        @Test
        @DisplayName("Ring straddling the antimeridian contains both 180 and -180")
        void antimeridianRing() {
            GeofenceRule dateline = rule(12L, List.of(
                    Coordinate.of(-17.001, 179.999), Coordinate.of(-17.001, -179.999),
                    Coordinate.of(-16.999, -179.999), Coordinate.of(-16.999, 179.999),
                    Coordinate.of(-17.001, 179.999)));

            assertThat(evaluator.contains(dateline, Coordinate.of(-17, 180))).isTrue();
            assertThat(evaluator.contains(dateline, Coordinate.of(-17, -180))).isTrue();
            assertThat(evaluator.contains(dateline, Coordinate.of(-17, 0))).isFalse();
            assertThat(evaluator.contains(dateline, Coordinate.of(-17, 179.9))).isFalse();
        }

        @Test
        @DisplayName("Ring closed across the antimeridian counts as closed")
        void closedAcrossAntimeridian() {
            List<Coordinate> ring = List.of(
                    Coordinate.of(-17.001, 180), Coordinate.of(-17.001, -179.999),
                    Coordinate.of(-16.999, -179.999), Coordinate.of(-16.999, 179.999),
                    Coordinate.of(-17.001, -180));

            evaluator.validateSubmission(ring);
        }

        @Test
        @DisplayName("Unclosed stored ring fails as a stored-geometry error")
        void unclosedStoredRing() {
            GeofenceRule broken = GeofenceRule.builder()
                    .id(7L)
                    .name("broken")
                    .ring(campusRing().subList(0, 4))
                    .marginMeters(0)
                    .active(true)
                    .build();

            assertThatThrownBy(() -> evaluator.contains(broken, CENTER))
                    .isInstanceOf(InvalidGeometryException.class)
                    .satisfies(ex -> {
                        InvalidGeometryException ige = (InvalidGeometryException) ex;
                        assertThat(ige.isStored()).isTrue();
                        assertThat(ige.getGeofenceId()).isEqualTo(7L);
                    })
                    .hasMessageContaining("not closed");
        }
    }

    @Nested
    @DisplayName("validateSubmission")
    class ValidateSubmission {

        @Test
        @DisplayName("Closed campus ring is accepted")
        void validRing() {
            evaluator.validateSubmission(campusRing());
        }

        @Test
        @DisplayName("Unclosed ring is rejected, never closed implicitly")
        void unclosed() {
            assertThatThrownBy(() -> evaluator.validateSubmission(campusRing().subList(0, 4)))
                    .isInstanceOf(InvalidGeometryException.class)
                    .hasMessageContaining("not closed");
        }

        @Test
        @DisplayName("Ring with fewer than four vertices is rejected")
        void tooFewVertices() {
            List<Coordinate> ring = List.of(
                    Coordinate.of(0, 0), Coordinate.of(0, 1), Coordinate.of(0, 0));

            assertThatThrownBy(() -> evaluator.validateSubmission(ring))
                    .isInstanceOf(InvalidGeometryException.class)
                    .hasMessageContaining("at least 4");
        }

        @Test
        @DisplayName("Self-intersecting ring is rejected")
        void bowTie() {
            List<Coordinate> ring = List.of(
                    Coordinate.of(0, 0), Coordinate.of(1, 1), Coordinate.of(0, 1),
                    Coordinate.of(1, 0), Coordinate.of(0, 0));

            assertThatThrownBy(() -> evaluator.validateSubmission(ring))
                    .isInstanceOf(InvalidGeometryException.class)
                    .hasMessageContaining("self-intersects")
                    .satisfies(ex -> assertThat(((InvalidGeometryException) ex).isStored()).isFalse());
        }

        @Test
        @DisplayName("Vertex outside WGS84 range is rejected")
        void outOfRange() {
            List<Coordinate> ring = List.of(
                    Coordinate.of(0, 0), Coordinate.of(0, 200), Coordinate.of(1, 1), Coordinate.of(0, 0));

            assertThatThrownBy(() -> evaluator.validateSubmission(ring))
                    .isInstanceOf(InvalidGeometryException.class)
                    .hasMessageContaining("out of WGS84 range");
        }
    }

    @Nested
    @DisplayName("validateStored")
    class ValidateStored {

        @Test
        @DisplayName("Ring spanning more than a hemisphere is reported against the geofence id")
        void ringBeyondHemisphere() {
            GeofenceRule global = rule(21L, List.of(
                    Coordinate.of(0, 0), Coordinate.of(0, 120), Coordinate.of(0, -120), Coordinate.of(0, 0)));

            assertThatThrownBy(() -> evaluator.validateStored(global))
                    .isInstanceOf(InvalidGeometryException.class)
                    .satisfies(ex -> assertThat(((InvalidGeometryException) ex).getGeofenceId()).isEqualTo(21L));
        }

        @Test
        @DisplayName("Campus ring passes")
        void campusRingPasses() {
            evaluator.validateStored(campus(1L, 50));
        }
    }

    @Nested
    @DisplayName("firstContaining")
    class FirstContaining {

        @Test
        @DisplayName("Smallest margin wins when several geofences contain the point")
        void smallestMarginFirst() {
            GeofenceRule wide = campus(1L, 50);
            GeofenceRule tight = campus(2L, 0);

            assertThat(evaluator.firstContaining(List.of(wide, tight), CENTER))
                    .get().extracting(GeofenceRule::getId).isEqualTo(2L);
        }

        @Test
        @DisplayName("Equal margins resolve to the lowest id")
        void tieByIdAscending() {
            assertThat(evaluator.firstContaining(List.of(campus(9L, 10), campus(4L, 10)), CENTER))
                    .get().extracting(GeofenceRule::getId).isEqualTo(4L);
        }

        @Test
        @DisplayName("Inactive geofences and empty lists yield nothing")
        void inactiveIgnored() {
            GeofenceRule inactive = GeofenceRule.builder()
                    .id(3L).name("off").ring(campusRing()).marginMeters(0).active(false).build();

            assertThat(evaluator.firstContaining(List.of(inactive), CENTER)).isEmpty();
            assertThat(evaluator.firstContaining(List.of(), CENTER)).isEmpty();
        }

        @Test
        @DisplayName("Wider margin matches when the tighter geofence does not")
        void fallsBackToWiderMargin() {
            assertThat(evaluator.firstContaining(List.of(campus(1L, 0), campus(2L, 50)), SOUTH_30M))
                    .get().extracting(GeofenceRule::getId).isEqualTo(2L);
        }
    }

    private static GeofenceRule rule(long id, List<Coordinate> ring) {
        return GeofenceRule.builder()
                .id(id)
                .name("zone " + id)
                .ring(ring)
                .marginMeters(0)
                .active(true)
                .build();
    }
}
