package com.example.presence.controller;

import com.example.presence.dto.TimeWindowRequest;
import com.example.presence.dto.TimeWindowResponse;
import com.example.presence.service.TimeWindowService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/time-windows")
@RequiredArgsConstructor
public class TimeWindowController {

    private final TimeWindowService timeWindowService;

    /**
     * Replaces the whole set. Each window is checked by the service before anything is deleted.
     */
    @PostMapping
    public List<TimeWindowResponse> replaceAll(@RequestBody List<TimeWindowRequest> windows) {
        return timeWindowService.replaceAll(windows);
    }

    @GetMapping
    public List<TimeWindowResponse> list() {
        return timeWindowService.findAll();
    }
}
