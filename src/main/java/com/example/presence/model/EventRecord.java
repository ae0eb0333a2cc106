package com.example.presence.model;

import com.example.presence.enums.VerificationMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything the event recorder persists for one presence check.
 */
@Value
@Builder
public class EventRecord {

    Long studentId;
    Coordinate coordinate;
    VerificationMethod method;
    Instant occurredAt;
    Decision decision;
}
