package com.revolution.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "revolution.rate-limit")
@Data
public class RateLimitProperties {

    private Login login = new Login();
    private Throttle throttle = new Throttle();

    @Data
    public static class Login {
        private int maxAttempts = 10;
        private long windowSeconds = 60;
        private int failureWeight = 2;
        private int lockoutThreshold = 20;
        private long lockoutSeconds = 900;
    }

    @Data
    public static class Throttle {
        private int limitPerMinute = 30;
        private long timeoutMs = 0;
    }
}
