package com.revolution.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "revolution.security")
@Data
public class SecurityProperties {

    private Cors cors = new Cors();
    private Password password = new Password();
    private Mfa mfa = new Mfa();
    private HashingPool hashingPool = new HashingPool();
    private long sweepIntervalMs = 60_000;
    private boolean trustForwardedHeaders = false;
    private boolean publicHealthEndpoint = true;

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");
    }

    /**
     * Argon2id cost parameters and the strength policy applied before hashing a new password.
     */
    @Data
    public static class Password {
        private int memoryKib = 65_536;
        private int iterations = 3;
        private int parallelism = 4;
        private int hashLength = 32;
        private int saltLength = 16;
        private int minLength = 8;
        private int maxLength = 128;
        private int minCharacterClasses = 3;
    }

    @Data
    public static class Mfa {
        private String issuer = "Revolution Trading Pros";
        private int backupCodeCount = 10;
        private int backupCodeLength = 10;
    }

    @Data
    public static class HashingPool {
        private int coreSize = 2;
        private int maxSize = 4;
        private int queueCapacity = 64;
        private long awaitTimeoutMs = 10_000;
    }
}
