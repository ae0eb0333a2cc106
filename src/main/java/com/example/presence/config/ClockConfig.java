package com.example.presence.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    private final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Zone used to turn instants into a time of day for window matching and daily statistics.
     * Falls back to the system zone when presence.zone-id is empty.
     */
    @Bean
    public ZoneId presenceZone(@Value("${presence.zone-id:}") String zoneId) {
        ZoneId zone = zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId.trim());
        log.info("Presence time zone: {}", zone);
        return zone;
    }
}
