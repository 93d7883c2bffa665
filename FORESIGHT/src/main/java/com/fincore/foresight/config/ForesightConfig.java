package com.fincore.foresight.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core bean wiring for FORESIGHT.
 */
@Configuration
public class ForesightConfig {

    /**
     * Clock used for every "recent window" computation.
     */
    @Bean
    public Clock foresightClock() {
        return Clock.systemUTC();
    }
}
