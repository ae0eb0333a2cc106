package com.example.presence.dto;

import com.example.presence.enums.VerificationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body of POST /presence/check. Range checks happen in PresenceRequestValidator.
 * The timestamp defaults to the server clock when omitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PresenceCheckRequest {
    private String matricule;
    private Double lat;
    private Double lon;
    private Double accuracy;
    private VerificationMethod method;
    private Instant timestamp;
}
