package com.example.presence.entities;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Geofence entity. The polygon is stored as a GeoJSON Polygon document ([lon, lat] positions).
 */
@Entity
@Table(name = "geofences")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Geofence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "polygon", nullable = false, length = 16000)
    private String polygonGeoJson;

    @Column(name = "margin_m", nullable = false)
    private Integer marginMeters;

    @Column(name = "is_active", nullable = false)
    private Boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (active == null) active = true;
        if (marginMeters == null) marginMeters = 0;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
