package com.fourpaws.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single clock source for every module. The zone decides which calendar day "today" is when
 * medical due dates are classified, so it follows the shelter's local time zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock shelterClock(@Value("${shelter.time-zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
