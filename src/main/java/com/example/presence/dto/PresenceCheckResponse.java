package com.example.presence.dto;

import com.example.presence.enums.AttendanceStatus;
import com.example.presence.model.Decision;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PresenceCheckResponse {
    private AttendanceStatus status;
    private String message;
    private String timeWindow;
    private String geofence;
    private Long geofenceId;
    private Long eventId;

    public static PresenceCheckResponse of(Decision decision, Long eventId) {
        return PresenceCheckResponse.builder()
                .status(decision.getStatus())
                .message(decision.getMessage())
                .timeWindow(decision.getTimeWindowName())
                .geofence(decision.getGeofenceName())
                .geofenceId(decision.getGeofenceId())
                .eventId(eventId)
                .build();
    }
}
