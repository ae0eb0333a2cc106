package com.example.presence.service;

import com.example.presence.dto.DailyStatsResponse;
import com.example.presence.dto.EventResponse;
import com.example.presence.dto.PageResponse;
import com.example.presence.entities.Geofence;
import com.example.presence.entities.PresenceEvent;
import com.example.presence.entities.Student;
import com.example.presence.enums.AttendanceStatus;
import com.example.presence.enums.VerificationMethod;
import com.example.presence.exception.InvalidInputException;
import com.example.presence.exception.ResourceNotFoundException;
import com.example.presence.repository.EventSpecifications;
import com.example.presence.repository.GeofenceRepository;
import com.example.presence.repository.PresenceEventRepository;
import com.example.presence.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the event log: filtered listing, lookup and per-day counters.
 * Days are calendar days in the presence zone.
 */
@Service
@RequiredArgsConstructor
public class EventQueryService {

    private final PresenceEventRepository eventRepository;
    private final StudentRepository studentRepository;
    private final GeofenceRepository geofenceRepository;
    private final ZoneId presenceZone;

    @Transactional(readOnly = true)
    public PageResponse<EventResponse> findEvents(String matricule, Instant from, Instant to, int limit, long offset) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidInputException("'from' must not be after 'to'");
        }
        Sort newestFirst = Sort.by(Sort.Direction.DESC, "occurredAt").and(Sort.by(Sort.Direction.DESC, "id"));
        Pageable pageable = Paging.of(limit, offset, newestFirst);

        Long studentId = null;
        if (matricule != null && !matricule.isBlank()) {
            Optional<Student> student = studentRepository.findByMatricule(matricule.trim());
            if (student.isEmpty()) {
                return new PageResponse<>(Collections.emptyList(), 0, limit, offset);
            }
            studentId = student.get().getId();
        }

        Specification<PresenceEvent> spec = Specification.where(EventSpecifications.forStudent(studentId))
                .and(EventSpecifications.occurredFrom(from))
                .and(EventSpecifications.occurredTo(to));
        Page<PresenceEvent> page = eventRepository.findAll(spec, pageable);

        return new PageResponse<>(toResponses(page.getContent()), page.getTotalElements(), limit, offset);
    }

    @Transactional(readOnly = true)
    public EventResponse getEvent(Long id) {
        PresenceEvent event = eventRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Event not found: " + id));
        return toResponses(List.of(event)).get(0);
    }

    @Transactional(readOnly = true)
    public DailyStatsResponse dailyStats(LocalDate date) {
        if (date == null) {
            throw new InvalidInputException("date is required (YYYY-MM-DD)");
        }
        Instant start = date.atStartOfDay(presenceZone).toInstant();
        Instant end = date.plusDays(1).atStartOfDay(presenceZone).toInstant();

        Map<AttendanceStatus, Long> byStatus = new EnumMap<>(AttendanceStatus.class);
        for (Object[] row : eventRepository.countByStatusBetween(start, end)) {
            byStatus.put((AttendanceStatus) row[0], ((Number) row[1]).longValue());
        }
        Map<VerificationMethod, Long> byMethod = new EnumMap<>(VerificationMethod.class);
        for (Object[] row : eventRepository.countByMethodBetween(start, end)) {
            byMethod.put((VerificationMethod) row[0], ((Number) row[1]).longValue());
        }

        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return DailyStatsResponse.builder()
                .date(date)
                .totalEvents(total)
                .presentCount(byStatus.getOrDefault(AttendanceStatus.PRESENT, 0L))
                .lateCount(byStatus.getOrDefault(AttendanceStatus.LATE, 0L))
                .absentCount(byStatus.getOrDefault(AttendanceStatus.ABSENT, 0L))
                .outsideCount(byStatus.getOrDefault(AttendanceStatus.OUTSIDE, 0L))
                .manualCount(byMethod.getOrDefault(VerificationMethod.MANUAL, 0L))
                .autoCount(byMethod.getOrDefault(VerificationMethod.AUTO, 0L))
                .build();
    }

    private List<EventResponse> toResponses(List<PresenceEvent> events) {
        Set<Long> studentIds = events.stream().map(PresenceEvent::getStudentId).collect(Collectors.toSet());
        Set<Long> geofenceIds = events.stream().map(PresenceEvent::getGeofenceId)
                .filter(Objects::nonNull).collect(Collectors.toSet());
        Map<Long, Student> students = studentRepository.findAllById(studentIds).stream()
                .collect(Collectors.toMap(Student::getId, Function.identity()));
        Map<Long, Geofence> geofences = geofenceRepository.findAllById(geofenceIds).stream()
                .collect(Collectors.toMap(Geofence::getId, Function.identity()));

        List<EventResponse> out = new ArrayList<>();
        for (PresenceEvent e : events) {
            Student s = students.get(e.getStudentId());
            Geofence g = e.getGeofenceId() == null ? null : geofences.get(e.getGeofenceId());
            out.add(EventResponse.builder()
                    .id(e.getId())
                    .studentId(e.getStudentId())
                    .studentMatricule(s == null ? null : s.getMatricule())
                    .studentLastName(s == null ? null : s.getLastName())
                    .studentFirstName(s == null ? null : s.getFirstName())
                    .status(e.getStatus())
                    .latitude(e.getLatitude())
                    .longitude(e.getLongitude())
                    .accuracy(e.getAccuracyMeters())
                    .geofenceId(e.getGeofenceId())
                    .geofenceName(g == null ? null : g.getName())
                    .method(e.getMethod())
                    .occurredAt(e.getOccurredAt())
                    .recordedAt(e.getRecordedAt())
                    .build());
        }
        return out;
    }
}
