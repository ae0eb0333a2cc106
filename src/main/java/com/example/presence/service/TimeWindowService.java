package com.example.presence.service;

import com.example.presence.dto.TimeWindowRequest;
import com.example.presence.dto.TimeWindowResponse;
import com.example.presence.entities.TimeWindow;
import com.example.presence.exception.InvalidInputException;
import com.example.presence.repository.TimeWindowRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class TimeWindowService {

    private final Logger log = LoggerFactory.getLogger(TimeWindowService.class);

    private final TimeWindowRepository timeWindowRepository;

    /**
     * Replace every time window in one transaction. Nothing is written if any window is invalid.
     * Windows cannot span midnight: start must be strictly before end.
     */
    @Transactional
    public List<TimeWindowResponse> replaceAll(List<TimeWindowRequest> requests) {
        List<TimeWindowRequest> input = requests == null ? Collections.emptyList() : requests;
        List<TimeWindow> windows = new ArrayList<>();
        for (TimeWindowRequest r : input) {
            if (r == null || r.getName() == null || r.getName().isBlank()) {
                throw new InvalidInputException("Time window name is required");
            }
            if (r.getStartTime() == null || r.getEndTime() == null) {
                throw new InvalidInputException("Time window '" + r.getName() + "' requires startTime and endTime");
            }
            if (!r.getStartTime().isBefore(r.getEndTime())) {
                throw new InvalidInputException("Time window '" + r.getName()
                        + "' must start before it ends (windows cannot span midnight)");
            }
            windows.add(TimeWindow.builder()
                    .name(r.getName().trim())
                    .startTime(r.getStartTime())
                    .endTime(r.getEndTime())
                    .active(r.getActive() == null || r.getActive())
                    .build());
        }

        timeWindowRepository.deleteAllInBatch();
        timeWindowRepository.saveAllAndFlush(windows);
        log.info("Replaced time windows: {} windows", windows.size());
        return findAll();
    }

    @Transactional(readOnly = true)
    public List<TimeWindowResponse> findAll() {
        return timeWindowRepository.findAllByOrderByStartTimeAscIdAsc().stream()
                .map(TimeWindowService::toResponse)
                .collect(Collectors.toList());
    }

    private static TimeWindowResponse toResponse(TimeWindow w) {
        return TimeWindowResponse.builder()
                .id(w.getId())
                .name(w.getName())
                .startTime(w.getStartTime())
                .endTime(w.getEndTime())
                .active(w.getActive())
                .createdAt(w.getCreatedAt())
                .updatedAt(w.getUpdatedAt())
                .build();
    }
}
