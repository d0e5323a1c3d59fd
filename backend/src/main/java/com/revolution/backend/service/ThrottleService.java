package com.revolution.backend.service;

import com.revolution.backend.config.RateLimitProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Request throttling for token refresh and MFA management routes, one limiter per caller key.
 */
@Service
public class ThrottleService {

    private final RateLimiterConfig config;
    private final int limitPerMinute;
    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    public ThrottleService(RateLimitProperties properties) {
        this.limitPerMinute = properties.getThrottle().getLimitPerMinute();
        this.config = RateLimiterConfig.custom()
                .limitForPeriod(limitPerMinute)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ofMillis(properties.getThrottle().getTimeoutMs()))
                .build();
    }

    public Decision acquire(String key) {
        RateLimiter limiter = limiters.computeIfAbsent(key, ignored -> RateLimiter.of("throttle-" + key, config));
        if (limiter.acquirePermission()) {
            return new Decision(true, limitPerMinute, limiter.getMetrics().getAvailablePermissions(), 0);
        }
        return new Decision(false, limitPerMinute, 0, retryAfterSeconds(limiter));
    }

    public int trackedKeys() {
        return limiters.size();
    }

    /**
     * Drops limiters that have a full budget again; they would be recreated identically on next use.
     */
    public int evictIdle() {
        int before = limiters.size();
        limiters.values().removeIf(limiter -> limiter.getMetrics().getAvailablePermissions() >= limitPerMinute);
        return before - limiters.size();
    }

    private static long retryAfterSeconds(RateLimiter limiter) {
        if (limiter instanceof AtomicRateLimiter atomic) {
            long nanos = atomic.getDetailedMetrics().getNanosToWait();
            return Math.max(1, TimeUnit.NANOSECONDS.toSeconds(nanos) + 1);
        }
        return 60;
    }

    public record Decision(boolean allowed, int limit, int remaining, long retryAfterSeconds) {
    }
}
