package com.example.records.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RecordsProperties.class)
public class RecordsConfig {

    /**
     * Clock used to stamp exported reports.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
