package com.wrestling.ratings.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // "Today" for period clipping and school-year eligibility
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
