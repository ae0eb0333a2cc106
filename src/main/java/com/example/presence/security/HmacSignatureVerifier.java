package com.example.presence.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies signed requests from mobile clients.
 *
 * Headers:
 * - x-api-key: key id, must match the configured key
 * - x-device-id: device identifier
 * - x-ts: ISO-8601 timestamp with offset, within the allowed skew of the server clock
 * - x-signature: hex HMAC-SHA256 of "{x-ts}." followed by the raw request body
 */
@Component
public class HmacSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final String apiKey;
    private final byte[] signingSecret;
    private final long allowedSkewSeconds;
    private final Clock clock;

    public HmacSignatureVerifier(@Value("${presence.hmac.api-key}") String apiKey,
                                 @Value("${presence.hmac.signing-secret}") String signingSecret,
                                 @Value("${presence.hmac.allowed-skew-seconds:120}") long allowedSkewSeconds,
                                 Clock clock) {
        this.apiKey = apiKey;
        this.signingSecret = signingSecret.getBytes(StandardCharsets.UTF_8);
        this.allowedSkewSeconds = allowedSkewSeconds;
        this.clock = clock;
    }

    public void verify(String requestApiKey, String deviceId, String ts, String signature, byte[] body) {
        if (isBlank(requestApiKey) || isBlank(deviceId) || isBlank(ts) || isBlank(signature)) {
            throw new HmacVerificationException(HttpStatus.UNAUTHORIZED, "Missing HMAC headers");
        }
        if (!constantTimeEquals(apiKey, requestApiKey)) {
            throw new HmacVerificationException(HttpStatus.UNAUTHORIZED, "Unknown API key");
        }

        Instant sentAt;
        try {
            sentAt = OffsetDateTime.parse(ts).toInstant();
        } catch (DateTimeParseException ex) {
            throw new HmacVerificationException(HttpStatus.BAD_REQUEST, "Invalid x-ts format");
        }
        long skew = Math.abs(Duration.between(sentAt, clock.instant()).getSeconds());
        if (skew > allowedSkewSeconds) {
            throw new HmacVerificationException(HttpStatus.UNAUTHORIZED, "Timestamp skew too large");
        }

        String expected = sign(ts, body);
        if (!constantTimeEquals(expected, signature.trim().toLowerCase(Locale.ROOT))) {
            throw new HmacVerificationException(HttpStatus.UNAUTHORIZED, "Invalid signature");
        }
    }

    public String sign(String ts, byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(signingSecret, ALGORITHM));
            mac.update((ts + ".").getBytes(StandardCharsets.UTF_8));
            mac.update(body == null ? new byte[0] : body);
            return HexFormat.of().formatHex(mac.doFinal());
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
