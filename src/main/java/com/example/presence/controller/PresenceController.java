package com.example.presence.controller;

import com.example.presence.dto.PresenceCheckRequest;
import com.example.presence.dto.PresenceCheckResponse;
import com.example.presence.security.HmacAuthenticationFilter;
import com.example.presence.service.PresenceCheckService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/presence")
@RequiredArgsConstructor
public class PresenceController {

    private final Logger log = LoggerFactory.getLogger(PresenceController.class);

    private final PresenceCheckService presenceCheckService;

    @PostMapping("/check")
    public PresenceCheckResponse check(@RequestBody PresenceCheckRequest request,
                                       @RequestAttribute(name = HmacAuthenticationFilter.DEVICE_ID_ATTRIBUTE,
                                               required = false) String deviceId) {
        log.debug("Presence check from device={} matricule={}", deviceId, request.getMatricule());
        return presenceCheckService.check(request);
    }
}
