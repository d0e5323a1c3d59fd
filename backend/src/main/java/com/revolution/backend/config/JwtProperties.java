package com.revolution.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "jwt")
@Data
public class JwtProperties {

    private String secret;

    /**
     * Optional. When blank the refresh key is derived from {@link #secret}.
     */
    private String refreshSecret;

    private String issuer = "revolution-trading-pros";
    private String audience = "revolution-trading-pros-api";
    private Duration expiration = Duration.ofHours(1);
    private Duration refreshExpiration = Duration.ofDays(7);
    private boolean rotateRefreshTokens = true;
}
