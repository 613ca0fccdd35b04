package com.ama.nipreset.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single time source for issuance, expiry and rate-limit windows.
 * UTC, so LocalDateTime arithmetic never crosses a DST shift.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
