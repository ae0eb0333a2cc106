package com.example.presence.service;

import com.example.presence.entities.Geofence;
import com.example.presence.entities.TimeWindow;
import com.example.presence.exception.InvalidGeometryException;
import com.example.presence.geo.GeoJsonPolygonCodec;
import com.example.presence.geo.GeofenceEvaluator;
import com.example.presence.model.ConfigurationSnapshot;
import com.example.presence.repository.GeofenceRepository;
import com.example.presence.repository.TimeWindowRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.presence.CampusFixtures.campusRing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConfigurationSnapshotService")
class ConfigurationSnapshotServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T08:10:00Z");

    @Mock
    private GeofenceRepository geofenceRepository;

    @Mock
    private TimeWindowRepository timeWindowRepository;

    private GeoJsonPolygonCodec codec;
    private ConfigurationSnapshotService service;

    @BeforeEach
    void setUp() {
        codec = new GeoJsonPolygonCodec(new ObjectMapper());
        service = new ConfigurationSnapshotService(geofenceRepository, timeWindowRepository, codec,
                new GeofenceEvaluator(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Geofence geofence(long id, String polygon) {
        return Geofence.builder().id(id).name("zone " + id).polygonGeoJson(polygon).marginMeters(50).active(true).build();
    }

    @Test
    @DisplayName("Snapshot holds the active rules and the instant it was loaded")
    void buildsSnapshot() {
        // Given
        when(geofenceRepository.findByActiveTrueOrderByMarginMetersAscIdAsc())
                .thenReturn(List.of(geofence(1L, codec.write(campusRing()))));
        when(timeWindowRepository.findByActiveTrueOrderByStartTimeAscIdAsc())
                .thenReturn(List.of(TimeWindow.builder().id(10L).name("Entrée")
                        .startTime(LocalTime.of(8, 0)).endTime(LocalTime.of(8, 30)).active(true).build()));

        // When
        ConfigurationSnapshot snapshot = service.currentSnapshot();

        // Then
        assertThat(snapshot.getLoadedAt()).isEqualTo(NOW);
        assertThat(snapshot.getGeofences()).singleElement()
                .satisfies(g -> {
                    assertThat(g.getId()).isEqualTo(1L);
                    assertThat(g.getRing()).isEqualTo(campusRing());
                    assertThat(g.getMarginMeters()).isEqualTo(50.0);
                });
        assertThat(snapshot.getTimeWindows()).extracting("name").containsExactly("Entrée");
    }

    @Test
    @DisplayName("Unclosed stored ring fails while the snapshot is built")
    void unclosedStoredRingFailsEagerly() {
        // Given
        when(geofenceRepository.findByActiveTrueOrderByMarginMetersAscIdAsc())
                .thenReturn(List.of(geofence(5L, codec.write(campusRing().subList(0, 4)))));

        // When / Then
        assertThatThrownBy(() -> service.currentSnapshot())
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("not closed")
                .satisfies(ex -> {
                    InvalidGeometryException ige = (InvalidGeometryException) ex;
                    assertThat(ige.isStored()).isTrue();
                    assertThat(ige.getGeofenceId()).isEqualTo(5L);
                });
        verify(geofenceRepository).findByActiveTrueOrderByMarginMetersAscIdAsc();
        verifyNoInteractions(timeWindowRepository);
    }
}
