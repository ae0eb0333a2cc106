package com.example.presence.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upsert payload, matched on name. The polygon is a GeoJSON Polygon whose exterior ring is closed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceRequest {

    @NotBlank
    @Size(max = 100)
    private String name;

    @NotNull
    private JsonNode polygon;

    @PositiveOrZero
    private Integer marginMeters;
}
