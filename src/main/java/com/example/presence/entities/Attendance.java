package com.example.presence.entities;

import com.example.presence.enums.AttendanceStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Decision record of a presence check, linked to its event and to the matched time window.
 * ABSENT decisions carry no time window.
 */
@Entity
@Immutable
@Table(name = "attendances", indexes = {
        @Index(name = "idx_attendance_event", columnList = "event_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Attendance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private Long studentId;

    @Column(name = "event_id", nullable = false, updatable = false)
    private Long eventId;

    @Column(name = "time_window_id", updatable = false)
    private Long timeWindowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private AttendanceStatus status;

    @Column(name = "geofence_id", updatable = false)
    private Long geofenceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
