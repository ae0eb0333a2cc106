package com.example.presence.model;

import com.example.presence.enums.AttendanceStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Result of the decision table. Geofence fields are only set for PRESENT,
 * time window fields for every status but ABSENT.
 */
@Value
@Builder
public class Decision {

    AttendanceStatus status;
    Long geofenceId;
    String geofenceName;
    Long timeWindowId;
    String timeWindowName;
    String message;

    public static Decision absent() {
        return Decision.builder()
                .status(AttendanceStatus.ABSENT)
                .message("No active time window")
                .build();
    }

    public static Decision present(TimeWindowRule window, GeofenceRule geofence) {
        return Decision.builder()
                .status(AttendanceStatus.PRESENT)
                .geofenceId(geofence.getId())
                .geofenceName(geofence.getName())
                .timeWindowId(window.getId())
                .timeWindowName(window.getName())
                .message("Present inside geofence")
                .build();
    }

    public static Decision late(TimeWindowRule window) {
        return Decision.builder()
                .status(AttendanceStatus.LATE)
                .timeWindowId(window.getId())
                .timeWindowName(window.getName())
                .message("Late (manual verification)")
                .build();
    }

    public static Decision outside(TimeWindowRule window) {
        return Decision.builder()
                .status(AttendanceStatus.OUTSIDE)
                .timeWindowId(window.getId())
                .timeWindowName(window.getName())
                .message("Outside geofence")
                .build();
    }
}
