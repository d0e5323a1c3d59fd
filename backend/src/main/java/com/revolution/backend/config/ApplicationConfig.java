package com.revolution.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans shared by the auth services.
 */
@Configuration
public class ApplicationConfig {

    /**
     * Single time source for token expiry, revocation, rate-limit windows and TOTP steps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
