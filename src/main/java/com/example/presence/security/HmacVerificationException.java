package com.example.presence.security;

import org.springframework.http.HttpStatus;

/**
 * Rejected device request. Raised by HmacSignatureVerifier and answered directly by the filter.
 */
public class HmacVerificationException extends RuntimeException {

    private final HttpStatus status;

    public HmacVerificationException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
