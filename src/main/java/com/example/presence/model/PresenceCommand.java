package com.example.presence.model;

import com.example.presence.enums.VerificationMethod;
import lombok.Value;

import java.time.Instant;

/**
 * Validated presence check input.
 */
@Value
public class PresenceCommand {

    String matricule;
    Coordinate coordinate;
    VerificationMethod method;
    Instant timestamp;
}
