package com.example.presence.controller;

import com.example.presence.dto.ErrorResponse;
import com.example.presence.enums.ErrorKind;
import com.example.presence.exception.ConflictException;
import com.example.presence.exception.InvalidGeometryException;
import com.example.presence.exception.InvalidInputException;
import com.example.presence.exception.RecorderFailureException;
import com.example.presence.exception.ResourceNotFoundException;
import com.example.presence.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service failures to {@link ErrorResponse} bodies. The kind field carries the error taxonomy.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex) {
        log.debug("Invalid input: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> errors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            errors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, "Validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, "Malformed request body", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT,
                "Invalid value for parameter '" + ex.getName() + "'", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return build(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT,
                "Missing parameter '" + ex.getParameterName() + "'", null);
    }

    /**
     * A submitted polygon is the caller's mistake (422). A stored one that no longer validates
     * is a configuration error on our side (500).
     */
    @ExceptionHandler(InvalidGeometryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidGeometry(InvalidGeometryException ex) {
        if (ex.isStored()) {
            log.error("Stored geofence {} is unusable: {}", ex.getGeofenceId(), ex.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("geofenceId", ex.getGeofenceId());
            return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INVALID_GEOMETRY, ex.getMessage(), details);
        }
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ErrorKind.INVALID_GEOMETRY, ex.getMessage(), null);
    }

    @ExceptionHandler(RecorderFailureException.class)
    public ResponseEntity<ErrorResponse> handleRecorderFailure(RecorderFailureException ex) {
        Decision decision = ex.getDecision();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", decision.getStatus().wireValue());
        details.put("geofenceId", decision.getGeofenceId());
        details.put("timeWindow", decision.getTimeWindowName());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.RECORDER_FAILURE, ex.getMessage(), details);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex) {
        return build(HttpStatus.CONFLICT, ErrorKind.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        // framework errors (unknown path, wrong verb) keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError) {
            HttpStatusCode code = frameworkError.getStatusCode();
            ErrorResponse body = ErrorResponse.builder()
                    .timestamp(Instant.now())
                    .status(code.value())
                    .error(code instanceof HttpStatus status ? status.getReasonPhrase() : String.valueOf(code.value()))
                    .message(ex.getMessage())
                    .build();
            return ResponseEntity.status(code).body(body);
        }
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal server error", null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ErrorKind kind, String message,
                                                Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .kind(kind == null ? null : kind.getLabel())
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
