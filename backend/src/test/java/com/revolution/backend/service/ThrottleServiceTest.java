package com.revolution.backend.service;

import com.revolution.backend.config.RateLimitProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ThrottleServiceTest {

    private ThrottleService throttleService;

    @BeforeEach
    void setUp() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.getThrottle().setLimitPerMinute(3);
        properties.getThrottle().setTimeoutMs(0);
        throttleService = new ThrottleService(properties);
    }

    @Test
    void allowsUpToLimitThenRejectsWithRetryAfter() {
        assertThat(throttleService.acquire("user:1").remaining()).isEqualTo(2);
        assertThat(throttleService.acquire("user:1").allowed()).isTrue();
        assertThat(throttleService.acquire("user:1").allowed()).isTrue();

        ThrottleService.Decision rejected = throttleService.acquire("user:1");

        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.limit()).isEqualTo(3);
        assertThat(rejected.remaining()).isZero();
        assertThat(rejected.retryAfterSeconds()).isBetween(1L, 61L);
    }

    @Test
    void keysAreIndependent() {
        for (int i = 0; i < 3; i++) {
            throttleService.acquire("ip:203.0.113.1");
        }

        assertThat(throttleService.acquire("ip:203.0.113.1").allowed()).isFalse();
        assertThat(throttleService.acquire("ip:203.0.113.2").allowed()).isTrue();
        assertThat(throttleService.trackedKeys()).isEqualTo(2);
    }

    @Test
    void evictIdleKeepsLimitersThatHaveSpentPermits() {
        throttleService.acquire("user:9");

        assertThat(throttleService.evictIdle()).isZero();
        assertThat(throttleService.trackedKeys()).isEqualTo(1);
    }
}
