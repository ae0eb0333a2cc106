package com.example.presence.exception;

import com.example.presence.enums.ErrorKind;

/**
 * Polygon that cannot be used as a geofence boundary.
 *
 * A stored geofence failing validation is a configuration integrity problem and is not
 * attributable to the caller of a presence check. A submitted polygon failing validation
 * is the submitter's error.
 */
public class InvalidGeometryException extends PresenceException {

    private final Long geofenceId;
    private final boolean stored;

    private InvalidGeometryException(Long geofenceId, boolean stored, String message, Throwable cause) {
        super(ErrorKind.INVALID_GEOMETRY, message, cause);
        this.geofenceId = geofenceId;
        this.stored = stored;
    }

    public static InvalidGeometryException forStoredGeofence(Long geofenceId, String reason) {
        return forStoredGeofence(geofenceId, reason, null);
    }

    public static InvalidGeometryException forStoredGeofence(Long geofenceId, String reason, Throwable cause) {
        return new InvalidGeometryException(geofenceId, true,
                "Geofence " + geofenceId + " has invalid geometry: " + reason, cause);
    }

    public static InvalidGeometryException forSubmission(String reason) {
        return forSubmission(reason, null);
    }

    public static InvalidGeometryException forSubmission(String reason, Throwable cause) {
        return new InvalidGeometryException(null, false, "Invalid polygon: " + reason, cause);
    }

    public Long getGeofenceId() {
        return geofenceId;
    }

    public boolean isStored() {
        return stored;
    }
}
