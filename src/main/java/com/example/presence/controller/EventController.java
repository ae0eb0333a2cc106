package com.example.presence.controller;

import com.example.presence.dto.DailyStatsResponse;
import com.example.presence.dto.EventResponse;
import com.example.presence.dto.PageResponse;
import com.example.presence.service.EventQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;

@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
public class EventController {

    private final EventQueryService eventQueryService;

    /**
     * Newest first. from/to are ISO-8601 instants, both inclusive.
     */
    @GetMapping
    public PageResponse<EventResponse> list(@RequestParam(required = false) String matricule,
                                            @RequestParam(required = false) Instant from,
                                            @RequestParam(required = false) Instant to,
                                            @RequestParam(defaultValue = "50") int limit,
                                            @RequestParam(defaultValue = "0") long offset) {
        return eventQueryService.findEvents(matricule, from, to, limit, offset);
    }

    @GetMapping("/{id}")
    public EventResponse get(@PathVariable Long id) {
        return eventQueryService.getEvent(id);
    }

    @GetMapping("/stats/daily")
    public DailyStatsResponse daily(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return eventQueryService.dailyStats(date);
    }
}
