package com.roadside.location.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LocationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
