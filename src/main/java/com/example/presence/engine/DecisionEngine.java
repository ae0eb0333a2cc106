package com.example.presence.engine;

import com.example.presence.enums.VerificationMethod;
import com.example.presence.exception.InvalidInputException;
import com.example.presence.geo.GeofenceEvaluator;
import com.example.presence.model.ConfigurationSnapshot;
import com.example.presence.model.Coordinate;
import com.example.presence.model.Decision;
import com.example.presence.model.GeofenceRule;
import com.example.presence.model.TimeWindowRule;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decision table for one presence check, evaluated in this order:
 * <ol>
 *     <li>no active time window → ABSENT (location is not looked at)</li>
 *     <li>inside a geofence → PRESENT with the containing geofence</li>
 *     <li>outside, manual → LATE</li>
 *     <li>outside, automatic → OUTSIDE</li>
 * </ol>
 * Stateless: the configuration is passed in with every call.
 */
@Component
@RequiredArgsConstructor
public class DecisionEngine {

    private final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final TimeWindowMatcher timeWindowMatcher;
    private final GeofenceEvaluator geofenceEvaluator;

    public Decision decide(String identity,
                           Coordinate coordinate,
                           VerificationMethod method,
                           Instant timestamp,
                           ConfigurationSnapshot snapshot) {
        if (coordinate == null || !coordinate.isWithinRange()) {
            throw new InvalidInputException("Coordinate out of range: " + coordinate);
        }
        if (method == null) {
            throw new InvalidInputException("Verification method is required");
        }
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(snapshot, "snapshot");

        Optional<TimeWindowRule> window = timeWindowMatcher.activeWindow(snapshot.getTimeWindows(), timestamp);
        if (window.isEmpty()) {
            log.debug("decide identity={} ts={} config@{} -> absent (no active window)",
                    identity, timestamp, snapshot.getLoadedAt());
            return Decision.absent();
        }

        Optional<GeofenceRule> containing = geofenceEvaluator.firstContaining(snapshot.getGeofences(), coordinate);
        Decision decision;
        if (containing.isPresent()) {
            decision = Decision.present(window.get(), containing.get());
        } else if (method == VerificationMethod.MANUAL) {
            decision = Decision.late(window.get());
        } else {
            decision = Decision.outside(window.get());
        }
        log.debug("decide identity={} ts={} config@{} window={} geofence={} method={} -> {}",
                identity, timestamp, snapshot.getLoadedAt(), window.get().getName(),
                decision.getGeofenceName(), method, decision.getStatus());
        return decision;
    }
}
