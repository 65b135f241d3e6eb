package com.rcmp.marketplace.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * System clock used for token expiry, webhook tolerance and rate-limit windows.
 * Tests replace it with a fixed or mutable clock.
 *
 * @author Marketplace Team
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
