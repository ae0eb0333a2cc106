package com.example.presence.dto;

import com.example.presence.enums.AttendanceStatus;
import com.example.presence.enums.VerificationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event with the student and geofence names resolved.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventResponse {
    private Long id;
    private Long studentId;
    private String studentMatricule;
    private String studentLastName;
    private String studentFirstName;
    private AttendanceStatus status;
    private Double latitude;
    private Double longitude;
    private Double accuracy;
    private Long geofenceId;
    private String geofenceName;
    private VerificationMethod method;
    private Instant occurredAt;
    private Instant recordedAt;
}
