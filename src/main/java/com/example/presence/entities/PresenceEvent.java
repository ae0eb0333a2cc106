package com.example.presence.entities;

import com.example.presence.enums.AttendanceStatus;
import com.example.presence.enums.VerificationMethod;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One verification attempt. Insert-only: no setters, every column non-updatable.
 */
@Entity
@Immutable
@Table(name = "events",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_events_student_occurred", columnNames = {"student_id", "occurred_at"})
        },
        indexes = {
                @Index(name = "idx_events_student_occurred", columnList = "student_id, occurred_at"),
                @Index(name = "idx_events_occurred", columnList = "occurred_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class PresenceEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private Long studentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private AttendanceStatus status;

    @Column(nullable = false, updatable = false)
    private Double latitude;

    @Column(nullable = false, updatable = false)
    private Double longitude;

    // informational, not used by the decision
    @Column(name = "accuracy_m", updatable = false)
    private Double accuracyMeters;

    @Column(name = "geofence_id", updatable = false)
    private Long geofenceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private VerificationMethod method;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
