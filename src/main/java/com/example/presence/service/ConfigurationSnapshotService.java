package com.example.presence.service;

import com.example.presence.entities.Geofence;
import com.example.presence.entities.TimeWindow;
import com.example.presence.geo.GeoJsonPolygonCodec;
import com.example.presence.geo.GeofenceEvaluator;
import com.example.presence.model.ConfigurationSnapshot;
import com.example.presence.model.GeofenceRule;
import com.example.presence.model.TimeWindowRule;
import com.example.presence.repository.GeofenceRepository;
import com.example.presence.repository.TimeWindowRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads the active geofences and time windows for one decision.
 * Both sets are read in one repeatable-read transaction so a concurrent
 * replace-all is seen either entirely or not at all.
 * Every active geofence ring is validated here, before any point is tested against it.
 */
@Service
@RequiredArgsConstructor
public class ConfigurationSnapshotService {

    private final GeofenceRepository geofenceRepository;
    private final TimeWindowRepository timeWindowRepository;
    private final GeoJsonPolygonCodec polygonCodec;
    private final GeofenceEvaluator geofenceEvaluator;
    private final Clock clock;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ConfigurationSnapshot currentSnapshot() {
        List<GeofenceRule> geofences = geofenceRepository.findByActiveTrueOrderByMarginMetersAscIdAsc()
                .stream()
                .map(this::toRule)
                .collect(Collectors.toList());
        List<TimeWindowRule> windows = timeWindowRepository.findByActiveTrueOrderByStartTimeAscIdAsc()
                .stream()
                .map(ConfigurationSnapshotService::toRule)
                .collect(Collectors.toList());
        return ConfigurationSnapshot.of(geofences, windows, clock.instant());
    }

    private GeofenceRule toRule(Geofence g) {
        GeofenceRule rule = GeofenceRule.builder()
                .id(g.getId())
                .name(g.getName())
                .ring(polygonCodec.readStored(g.getId(), g.getPolygonGeoJson()))
                .marginMeters(g.getMarginMeters() == null ? 0 : g.getMarginMeters())
                .active(Boolean.TRUE.equals(g.getActive()))
                .build();
        geofenceEvaluator.validateStored(rule);
        return rule;
    }

    private static TimeWindowRule toRule(TimeWindow w) {
        return TimeWindowRule.builder()
                .id(w.getId())
                .name(w.getName())
                .startTime(w.getStartTime())
                .endTime(w.getEndTime())
                .active(Boolean.TRUE.equals(w.getActive()))
                .build();
    }
}
