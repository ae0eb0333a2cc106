package com.example.presence.controller;

import com.example.presence.dto.GeofenceRequest;
import com.example.presence.dto.GeofenceResponse;
import com.example.presence.service.GeofenceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/geofence")
@RequiredArgsConstructor
public class GeofenceController {

    private final GeofenceService geofenceService;

    @PostMapping
    public GeofenceResponse upsert(@Valid @RequestBody GeofenceRequest request) {
        return geofenceService.upsert(request);
    }

    @GetMapping
    public List<GeofenceResponse> list() {
        return geofenceService.findAll();
    }

    @PatchMapping("/{id}/active")
    public GeofenceResponse setActive(@PathVariable Long id, @RequestParam("value") boolean value) {
        return geofenceService.setActive(id, value);
    }
}
