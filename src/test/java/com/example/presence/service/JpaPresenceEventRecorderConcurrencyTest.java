package com.example.presence.service;

import com.example.presence.FixedClockConfig;
import com.example.presence.entities.PresenceEvent;
import com.example.presence.entities.Student;
import com.example.presence.enums.VerificationMethod;
import com.example.presence.model.Decision;
import com.example.presence.model.EventRecord;
import com.example.presence.model.RecordedEvent;
import com.example.presence.repository.PresenceEventRepository;
import com.example.presence.repository.StudentRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.presence.CampusFixtures.CENTER;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(FixedClockConfig.class)
@DisplayName("JpaPresenceEventRecorder under concurrent retries")
class JpaPresenceEventRecorderConcurrencyTest {

    private static final int THREADS = 8;
    private static final int ROUNDS = 10;
    private static final Instant FIRST = Instant.parse("2023-11-06T08:00:00Z");

    @Autowired
    private PresenceEventRecorder recorder;

    @Autowired
    private PresenceEventRepository eventRepository;

    @Autowired
    private StudentRepository studentRepository;

    private ExecutorService executor;
    private Long studentId;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
        studentId = studentRepository.findByMatricule("CON001")
                .orElseGet(() -> studentRepository.save(
                        Student.builder().matricule("CON001").lastName("Martin").firstName("Lea").build()))
                .getId();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Simultaneous identical records resolve to a single stored event")
    void simultaneousRetriesShareOneEvent() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            // Given
            Instant occurredAt = FIRST.plusSeconds(60L * round);
            EventRecord record = EventRecord.builder()
                    .studentId(studentId)
                    .coordinate(CENTER)
                    .method(VerificationMethod.AUTO)
                    .occurredAt(occurredAt)
                    .decision(Decision.absent())
                    .build();
            CountDownLatch start = new CountDownLatch(1);

            // When
            List<Future<RecordedEvent>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return recorder.record(record);
                }));
            }
            start.countDown();
            List<RecordedEvent> results = new ArrayList<>();
            for (Future<RecordedEvent> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            // Then
            assertThat(results).extracting(RecordedEvent::getEventId).containsOnly(results.get(0).getEventId());
            assertThat(results).filteredOn(r -> !r.isDuplicate()).hasSize(1);
            PresenceEvent stored = eventRepository.findByStudentIdAndOccurredAt(studentId, occurredAt).orElseThrow();
            assertThat(stored.getId()).isEqualTo(results.get(0).getEventId());
        }
    }
}
