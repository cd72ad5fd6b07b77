package com.rivaflow.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared time beans. All "now" reads go through the UTC clock; local session
 * dates and times are interpreted in the training zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public ZoneId trainingZone(@Value("${rivaflow.time.default-zone:UTC}") String zoneId) {
        return ZoneId.of(zoneId);
    }
}
