package com.cadence.backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
@EnableConfigurationProperties(OutreachProperties.class)
public class OutreachConfig {

    /**
     * Source of jitter for business-window slots.
     */
    @Bean
    public Random sendWindowRandom() {
        return new Random();
    }
}
