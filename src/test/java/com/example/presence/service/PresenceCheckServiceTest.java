package com.example.presence.service;

import com.example.presence.dto.PresenceCheckRequest;
import com.example.presence.dto.PresenceCheckResponse;
import com.example.presence.engine.DecisionEngine;
import com.example.presence.engine.TimeWindowMatcher;
import com.example.presence.entities.Student;
import com.example.presence.enums.AttendanceStatus;
import com.example.presence.enums.VerificationMethod;
import com.example.presence.exception.InvalidInputException;
import com.example.presence.exception.RecorderFailureException;
import com.example.presence.exception.ResourceNotFoundException;
import com.example.presence.geo.GeofenceEvaluator;
import com.example.presence.model.ConfigurationSnapshot;
import com.example.presence.model.EventRecord;
import com.example.presence.model.RecordedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.example.presence.CampusFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PresenceCheckService")
class PresenceCheckServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T08:10:00Z");

    @Mock
    private StudentService studentService;

    @Mock
    private ConfigurationSnapshotService snapshotService;

    @Mock
    private PresenceEventRecorder eventRecorder;

    private SimpleMeterRegistry meterRegistry;
    private PresenceCheckService service;
    private Student student;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        DecisionEngine engine = new DecisionEngine(new TimeWindowMatcher(ZoneOffset.UTC), new GeofenceEvaluator());
        service = new PresenceCheckService(new PresenceRequestValidator(), studentService, snapshotService,
                engine, eventRecorder, Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);

        student = Student.builder().id(42L).matricule("STU001").lastName("Dupont").firstName("Jean").active(true).build();
    }

    private ConfigurationSnapshot campusSnapshot() {
        return ConfigurationSnapshot.of(List.of(campus(1L, 50)),
                List.of(window(10L, "Entrée", "08:00", "08:30")), NOW);
    }

    private PresenceCheckRequest request(double lat, double lon, VerificationMethod method) {
        return PresenceCheckRequest.builder().matricule("STU001").lat(lat).lon(lon).method(method).build();
    }

    @Test
    @DisplayName("Decides, records and counts a successful check")
    void recordsDecision() {
        // Given
        when(studentService.findActiveByMatricule("STU001")).thenReturn(Optional.of(student));
        when(snapshotService.currentSnapshot()).thenReturn(campusSnapshot());
        when(eventRecorder.record(any())).thenReturn(new RecordedEvent(100L, false));

        // When
        PresenceCheckResponse response = service.check(
                request(CENTER.getLatitude(), CENTER.getLongitude(), VerificationMethod.AUTO));

        // Then
        assertThat(response.getStatus()).isEqualTo(AttendanceStatus.PRESENT);
        assertThat(response.getEventId()).isEqualTo(100L);
        assertThat(response.getGeofenceId()).isEqualTo(1L);
        assertThat(response.getTimeWindow()).isEqualTo("Entrée");

        ArgumentCaptor<EventRecord> captor = ArgumentCaptor.forClass(EventRecord.class);
        verify(eventRecorder).record(captor.capture());
        assertThat(captor.getValue().getStudentId()).isEqualTo(42L);
        assertThat(captor.getValue().getOccurredAt()).isEqualTo(NOW);
        assertThat(captor.getValue().getDecision().getStatus()).isEqualTo(AttendanceStatus.PRESENT);

        assertThat(meterRegistry.counter("presence.requests").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("presence.successes").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("presence.decisions", "status", "present").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Absent decisions are recorded too")
    void recordsAbsent() {
        when(studentService.findActiveByMatricule("STU001")).thenReturn(Optional.of(student));
        when(snapshotService.currentSnapshot()).thenReturn(campusSnapshot());
        when(eventRecorder.record(any())).thenReturn(new RecordedEvent(101L, false));
        PresenceCheckRequest late = request(CENTER.getLatitude(), CENTER.getLongitude(), VerificationMethod.AUTO);
        late.setTimestamp(Instant.parse("2024-01-15T09:00:00Z"));

        PresenceCheckResponse response = service.check(late);

        assertThat(response.getStatus()).isEqualTo(AttendanceStatus.ABSENT);
        assertThat(response.getEventId()).isEqualTo(101L);
    }

    @Test
    @DisplayName("Recorder failure carries the computed decision")
    void recorderFailure() {
        // Given
        when(studentService.findActiveByMatricule("STU001")).thenReturn(Optional.of(student));
        when(snapshotService.currentSnapshot()).thenReturn(campusSnapshot());
        when(eventRecorder.record(any())).thenThrow(new DataAccessResourceFailureException("database unavailable"));

        // When / Then
        assertThatThrownBy(() -> service.check(
                request(SOUTH_200M.getLatitude(), SOUTH_200M.getLongitude(), VerificationMethod.MANUAL)))
                .isInstanceOf(RecorderFailureException.class)
                .satisfies(ex -> assertThat(((RecorderFailureException) ex).getDecision().getStatus())
                        .isEqualTo(AttendanceStatus.LATE));

        assertThat(meterRegistry.counter("presence.requests").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("presence.successes").count()).isZero();
    }

    @Test
    @DisplayName("Unknown student is not found and nothing is recorded")
    void unknownStudent() {
        when(studentService.findActiveByMatricule("STU001")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.check(request(48.8571, 2.3527, VerificationMethod.AUTO)))
                .isInstanceOf(ResourceNotFoundException.class);

        verifyNoInteractions(snapshotService, eventRecorder);
    }

    @Test
    @DisplayName("Invalid input is rejected before any lookup")
    void invalidInput() {
        assertThatThrownBy(() -> service.check(request(123.0, 2.3527, VerificationMethod.AUTO)))
                .isInstanceOf(InvalidInputException.class);

        verifyNoInteractions(studentService, snapshotService, eventRecorder);
        assertThat(meterRegistry.counter("presence.requests").count()).isEqualTo(1.0);
    }
}
