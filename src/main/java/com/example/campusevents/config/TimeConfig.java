package com.example.campusevents.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    // every "now" and "today" in the services comes from here
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
