package com.example.presence.repository;

import com.example.presence.entities.PresenceEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PresenceEventRepository extends JpaRepository<PresenceEvent, Long>, JpaSpecificationExecutor<PresenceEvent> {

    Optional<PresenceEvent> findByStudentIdAndOccurredAt(Long studentId, Instant occurredAt);

    @Query("select e.status, count(e) from PresenceEvent e "
            + "where e.occurredAt >= :start and e.occurredAt < :end group by e.status")
    List<Object[]> countByStatusBetween(@Param("start") Instant start, @Param("end") Instant end);

    @Query("select e.method, count(e) from PresenceEvent e "
            + "where e.occurredAt >= :start and e.occurredAt < :end group by e.method")
    List<Object[]> countByMethodBetween(@Param("start") Instant start, @Param("end") Instant end);
}
