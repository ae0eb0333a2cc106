package com.example.presence.service;

import com.example.presence.entities.Attendance;
import com.example.presence.entities.PresenceEvent;
import com.example.presence.model.Decision;
import com.example.presence.model.EventRecord;
import com.example.presence.model.RecordedEvent;
import com.example.presence.repository.AttendanceRepository;
import com.example.presence.repository.PresenceEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Writes the event and its attendance row in one transaction.
 *
 * Two concurrent retries for the same student and timestamp may both miss the lookup;
 * the loser hits the unique key on (student_id, occurred_at) and returns the winner's
 * event, read back in a fresh transaction.
 */
@Component
public class JpaPresenceEventRecorder implements PresenceEventRecorder {

    private final Logger log = LoggerFactory.getLogger(JpaPresenceEventRecorder.class);

    private final PresenceEventRepository eventRepository;
    private final AttendanceRepository attendanceRepository;
    private final Clock clock;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate lookupTx;

    public JpaPresenceEventRecorder(PresenceEventRepository eventRepository,
                                    AttendanceRepository attendanceRepository,
                                    Clock clock,
                                    PlatformTransactionManager transactionManager) {
        this.eventRepository = eventRepository;
        this.attendanceRepository = attendanceRepository;
        this.clock = clock;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.lookupTx = new TransactionTemplate(transactionManager);
        this.lookupTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.lookupTx.setReadOnly(true);
    }

    @Override
    public RecordedEvent record(EventRecord record) {
        try {
            return writeTx.execute(status -> insertIfAbsent(record));
        } catch (DataIntegrityViolationException ex) {
            Optional<PresenceEvent> winner = lookupTx.execute(status ->
                    eventRepository.findByStudentIdAndOccurredAt(record.getStudentId(), record.getOccurredAt()));
            if (winner == null || winner.isEmpty()) {
                throw ex;
            }
            log.info("record: concurrent retry for studentId={} at {} resolved to id={}",
                    record.getStudentId(), record.getOccurredAt(), winner.get().getId());
            return new RecordedEvent(winner.get().getId(), true);
        }
    }

    private RecordedEvent insertIfAbsent(EventRecord record) {
        Optional<PresenceEvent> existing =
                eventRepository.findByStudentIdAndOccurredAt(record.getStudentId(), record.getOccurredAt());
        if (existing.isPresent()) {
            log.info("record: event already stored for studentId={} at {}, id={}",
                    record.getStudentId(), record.getOccurredAt(), existing.get().getId());
            return new RecordedEvent(existing.get().getId(), true);
        }

        Decision decision = record.getDecision();
        Instant now = clock.instant();
        PresenceEvent event = eventRepository.saveAndFlush(PresenceEvent.builder()
                .studentId(record.getStudentId())
                .status(decision.getStatus())
                .latitude(record.getCoordinate().getLatitude())
                .longitude(record.getCoordinate().getLongitude())
                .accuracyMeters(record.getCoordinate().getAccuracyMeters())
                .geofenceId(decision.getGeofenceId())
                .method(record.getMethod())
                .occurredAt(record.getOccurredAt())
                .recordedAt(now)
                .build());

        attendanceRepository.save(Attendance.builder()
                .studentId(record.getStudentId())
                .eventId(event.getId())
                .timeWindowId(decision.getTimeWindowId())
                .status(decision.getStatus())
                .geofenceId(decision.getGeofenceId())
                .createdAt(now)
                .build());

        return new RecordedEvent(event.getId(), false);
    }
}
