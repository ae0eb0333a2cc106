package com.example.presence.service;

import com.example.presence.dto.PresenceCheckRequest;
import com.example.presence.dto.PresenceCheckResponse;
import com.example.presence.engine.DecisionEngine;
import com.example.presence.entities.Student;
import com.example.presence.exception.InvalidGeometryException;
import com.example.presence.exception.RecorderFailureException;
import com.example.presence.exception.ResourceNotFoundException;
import com.example.presence.model.ConfigurationSnapshot;
import com.example.presence.model.Decision;
import com.example.presence.model.EventRecord;
import com.example.presence.model.PresenceCommand;
import com.example.presence.model.RecordedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;

/**
 * Presence check flow: validate → resolve student → load configuration → decide → record.
 *
 * Decision and recording are separate steps: when recording fails the decision is still
 * returned to the caller inside a RecorderFailureException.
 */
@Service
public class PresenceCheckService {

    private final Logger log = LoggerFactory.getLogger(PresenceCheckService.class);

    private final PresenceRequestValidator validator;
    private final StudentService studentService;
    private final ConfigurationSnapshotService snapshotService;
    private final DecisionEngine decisionEngine;
    private final PresenceEventRecorder eventRecorder;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Counter requests;
    private final Counter successes;

    public PresenceCheckService(PresenceRequestValidator validator,
                                StudentService studentService,
                                ConfigurationSnapshotService snapshotService,
                                DecisionEngine decisionEngine,
                                PresenceEventRecorder eventRecorder,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.validator = validator;
        this.studentService = studentService;
        this.snapshotService = snapshotService;
        this.decisionEngine = decisionEngine;
        this.eventRecorder = eventRecorder;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.requests = Counter.builder("presence.requests")
                .description("Presence requests received")
                .register(meterRegistry);
        this.successes = Counter.builder("presence.successes")
                .description("Presence checks decided and recorded")
                .register(meterRegistry);
    }

    public PresenceCheckResponse check(PresenceCheckRequest request) {
        requests.increment();

        PresenceCommand command = validator.validate(request, clock.instant()).orElseThrow();

        Student student = studentService.findActiveByMatricule(command.getMatricule())
                .orElseThrow(() -> new ResourceNotFoundException("Student not found: " + command.getMatricule()));

        Decision decision;
        try {
            ConfigurationSnapshot snapshot = snapshotService.currentSnapshot();
            decision = decisionEngine.decide(command.getMatricule(), command.getCoordinate(),
                    command.getMethod(), command.getTimestamp(), snapshot);
        } catch (InvalidGeometryException ex) {
            log.error("Configuration error while deciding for matricule={}: {}", command.getMatricule(), ex.getMessage());
            throw ex;
        }

        RecordedEvent recorded;
        try {
            recorded = eventRecorder.record(EventRecord.builder()
                    .studentId(student.getId())
                    .coordinate(command.getCoordinate())
                    .method(command.getMethod())
                    .occurredAt(command.getTimestamp())
                    .decision(decision)
                    .build());
        } catch (DataAccessException | TransactionException ex) {
            log.error("Failed to record event for matricule={} status={}", command.getMatricule(), decision.getStatus(), ex);
            throw new RecorderFailureException(decision, ex);
        }

        successes.increment();
        meterRegistry.counter("presence.decisions", "status", decision.getStatus().wireValue()).increment();
        log.info("Presence check matricule={} method={} -> {} (eventId={}{})",
                command.getMatricule(), command.getMethod().wireValue(), decision.getStatus().wireValue(),
                recorded.getEventId(), recorded.isDuplicate() ? ", duplicate" : "");
        return PresenceCheckResponse.of(decision, recorded.getEventId());
    }
}
