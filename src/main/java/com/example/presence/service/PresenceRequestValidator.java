package com.example.presence.service;

import com.example.presence.dto.PresenceCheckRequest;
import com.example.presence.model.Coordinate;
import com.example.presence.model.PresenceCommand;
import com.example.presence.model.Validated;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Boundary validation of a presence check. Runs before the decision engine; an invalid
 * result means no decision is made and no event is recorded.
 */
@Component
public class PresenceRequestValidator {

    public Validated<PresenceCommand> validate(PresenceCheckRequest request, Instant now) {
        if (request == null) {
            return Validated.invalid("Request body is required");
        }
        String matricule = request.getMatricule() == null ? null : request.getMatricule().trim();
        if (matricule == null || matricule.isEmpty()) {
            return Validated.invalid("matricule is required");
        }
        if (request.getLat() == null || request.getLon() == null) {
            return Validated.invalid("lat and lon are required");
        }
        Double accuracy = request.getAccuracy();
        if (accuracy != null && (!Double.isFinite(accuracy) || accuracy < 0)) {
            return Validated.invalid("accuracy must be a non-negative number of meters");
        }
        Coordinate coordinate = Coordinate.of(request.getLat(), request.getLon(), accuracy);
        if (!coordinate.isWithinRange()) {
            return Validated.invalid("Coordinate out of range: lat must be in [-90, 90] and lon in [-180, 180]");
        }
        if (request.getMethod() == null) {
            return Validated.invalid("method is required (auto or manual)");
        }
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : now;
        // events are stored with microsecond precision; dedup relies on equal timestamps
        timestamp = timestamp.truncatedTo(ChronoUnit.MICROS);
        return Validated.ok(new PresenceCommand(matricule, coordinate, request.getMethod(), timestamp));
    }
}
