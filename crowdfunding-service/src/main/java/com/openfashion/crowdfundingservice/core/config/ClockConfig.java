package com.openfashion.crowdfundingservice.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Trusted time source for deadlines and refund windows
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
