package com.demoPayroll.taxEngine.validation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock used by date-relative field rules (future/past dates, financial year range).
 */
@Configuration
public class ClockConfig {
    
    @Bean
    public Clock systemClock() {
        return Clock.systemDefaultZone();
    }
}
