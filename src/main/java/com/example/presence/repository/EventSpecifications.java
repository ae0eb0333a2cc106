package com.example.presence.repository;

import com.example.presence.entities.PresenceEvent;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Optional filters for the event log. A null argument yields no restriction.
 */
public final class EventSpecifications {

    private EventSpecifications() {
    }

    public static Specification<PresenceEvent> forStudent(Long studentId) {
        return (root, query, cb) -> studentId == null ? null : cb.equal(root.get("studentId"), studentId);
    }

    public static Specification<PresenceEvent> occurredFrom(Instant from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.get("occurredAt"), from);
    }

    public static Specification<PresenceEvent> occurredTo(Instant to) {
        return (root, query, cb) -> to == null ? null : cb.lessThanOrEqualTo(root.get("occurredAt"), to);
    }
}
