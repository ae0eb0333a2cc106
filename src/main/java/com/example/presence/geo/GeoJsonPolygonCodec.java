package com.example.presence.geo;

import com.example.presence.exception.InvalidGeometryException;
import com.example.presence.model.Coordinate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts between GeoJSON Polygon documents ({@code [lon, lat]} positions, exterior ring only)
 * and coordinate rings. Rings are never closed implicitly.
 */
@Component
@RequiredArgsConstructor
public class GeoJsonPolygonCodec {

    private static final String POLYGON = "Polygon";

    private final Logger log = LoggerFactory.getLogger(GeoJsonPolygonCodec.class);

    private final ObjectMapper objectMapper;

    public List<Coordinate> parseSubmitted(JsonNode geoJson) {
        return parse(geoJson, InvalidGeometryException::forSubmission);
    }

    public List<Coordinate> readStored(Long geofenceId, String json) {
        Function<String, InvalidGeometryException> failure =
                reason -> InvalidGeometryException.forStoredGeofence(geofenceId, reason);
        if (json == null || json.isBlank()) {
            throw failure.apply("polygon is empty");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw InvalidGeometryException.forStoredGeofence(geofenceId, "polygon is not valid JSON", ex);
        }
        return parse(node, failure);
    }

    /**
     * Stored document as-is, for listing. Text that is not JSON comes back as a string node
     * so one corrupt row does not hide the others.
     */
    public JsonNode storedDocument(Long geofenceId, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            log.warn("Geofence id={} polygon is not valid JSON: {}", geofenceId, ex.getOriginalMessage());
            return TextNode.valueOf(json);
        }
    }

    public JsonNode toGeoJson(List<Coordinate> ring) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", POLYGON);
        ArrayNode rings = root.putArray("coordinates");
        ArrayNode exterior = rings.addArray();
        for (Coordinate c : ring) {
            exterior.addArray().add(c.getLongitude()).add(c.getLatitude());
        }
        return root;
    }

    public String write(List<Coordinate> ring) {
        try {
            return objectMapper.writeValueAsString(toGeoJson(ring));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize polygon", ex);
        }
    }

    private List<Coordinate> parse(JsonNode geoJson, Function<String, InvalidGeometryException> failure) {
        if (geoJson == null || !geoJson.isObject()) {
            throw failure.apply("GeoJSON object expected");
        }
        if (!POLYGON.equals(geoJson.path("type").asText())) {
            throw failure.apply("GeoJSON must be of type Polygon");
        }
        JsonNode rings = geoJson.path("coordinates");
        if (!rings.isArray() || rings.isEmpty() || !rings.get(0).isArray()) {
            throw failure.apply("Polygon has no exterior ring");
        }
        List<Coordinate> ring = new ArrayList<>();
        for (JsonNode position : rings.get(0)) {
            if (!position.isArray() || position.size() < 2
                    || !position.get(0).isNumber() || !position.get(1).isNumber()) {
                throw failure.apply("each position must be [lon, lat]");
            }
            ring.add(Coordinate.of(position.get(1).asDouble(), position.get(0).asDouble()));
        }
        return ring;
    }
}
