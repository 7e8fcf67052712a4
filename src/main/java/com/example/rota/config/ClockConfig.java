package com.example.rota.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * Process clock used for clock-in/clock-out checks and timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
