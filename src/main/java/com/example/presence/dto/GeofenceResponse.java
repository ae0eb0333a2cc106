package com.example.presence.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceResponse {
    private Long id;
    private String name;
    private JsonNode polygon;
    private Integer marginMeters;
    private Boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
