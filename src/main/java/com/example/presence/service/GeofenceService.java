package com.example.presence.service;

import com.example.presence.dto.GeofenceRequest;
import com.example.presence.dto.GeofenceResponse;
import com.example.presence.entities.Geofence;
import com.example.presence.exception.ResourceNotFoundException;
import com.example.presence.geo.GeoJsonPolygonCodec;
import com.example.presence.geo.GeofenceEvaluator;
import com.example.presence.model.Coordinate;
import com.example.presence.repository.GeofenceRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class GeofenceService {

    private final Logger log = LoggerFactory.getLogger(GeofenceService.class);

    private final GeofenceRepository geofenceRepository;
    private final GeoJsonPolygonCodec polygonCodec;
    private final GeofenceEvaluator geofenceEvaluator;

    /**
     * Create or update a geofence by name. The polygon is validated before anything is written.
     */
    @Transactional
    public GeofenceResponse upsert(GeofenceRequest request) {
        List<Coordinate> ring = polygonCodec.parseSubmitted(request.getPolygon());
        geofenceEvaluator.validateSubmission(ring);

        String name = request.getName().trim();
        int margin = request.getMarginMeters() == null ? 0 : request.getMarginMeters();
        String polygon = polygonCodec.write(ring);

        Geofence geofence = geofenceRepository.findByName(name).orElse(null);
        if (geofence == null) {
            geofence = Geofence.builder()
                    .name(name)
                    .polygonGeoJson(polygon)
                    .marginMeters(margin)
                    .active(true)
                    .build();
            log.info("Creating geofence name={} vertices={} margin={}m", name, ring.size(), margin);
        } else {
            geofence.setPolygonGeoJson(polygon);
            geofence.setMarginMeters(margin);
            log.info("Updating geofence id={} name={} vertices={} margin={}m", geofence.getId(), name, ring.size(), margin);
        }
        return toResponse(geofenceRepository.saveAndFlush(geofence));
    }

    @Transactional(readOnly = true)
    public List<GeofenceResponse> findAll() {
        return geofenceRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public GeofenceResponse setActive(Long id, boolean active) {
        Geofence geofence = geofenceRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Geofence not found: " + id));
        geofence.setActive(active);
        log.info("Geofence id={} name={} active={}", id, geofence.getName(), active);
        return toResponse(geofenceRepository.saveAndFlush(geofence));
    }

    private GeofenceResponse toResponse(Geofence g) {
        return GeofenceResponse.builder()
                .id(g.getId())
                .name(g.getName())
                .polygon(polygonCodec.storedDocument(g.getId(), g.getPolygonGeoJson()))
                .marginMeters(g.getMarginMeters())
                .active(g.getActive())
                .createdAt(g.getCreatedAt())
                .updatedAt(g.getUpdatedAt())
                .build();
    }
}
