package com.example.presence.engine;

import com.example.presence.model.TimeWindowRule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the active time window covering the time-of-day of a timestamp.
 * Overlapping matches resolve to the earliest start, then the lowest id.
 */
@Component
@RequiredArgsConstructor
public class TimeWindowMatcher {

    static final Comparator<TimeWindowRule> ORDER = Comparator
            .comparing(TimeWindowRule::getStartTime)
            .thenComparing(TimeWindowRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ZoneId presenceZone;

    public Optional<TimeWindowRule> activeWindow(List<TimeWindowRule> windows, Instant timestamp) {
        if (windows == null || windows.isEmpty()) {
            return Optional.empty();
        }
        LocalTime timeOfDay = timestamp.atZone(presenceZone).toLocalTime();
        return windows.stream()
                .filter(TimeWindowRule::isActive)
                .sorted(ORDER)
                .filter(w -> w.covers(timeOfDay))
                .findFirst();
    }
}
