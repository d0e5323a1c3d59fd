package com.revolution.backend.security;

import com.revolution.backend.config.RateLimitProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window attempt limiter with lockout escalation, keyed by client IP or account.
 *
 * <p>Each attempt adds one unit, each failed login adds {@code failureWeight} units. More than
 * {@code maxAttempts} units inside the window answers {@code LIMITED} until the window ends; reaching
 * {@code lockoutThreshold} sets {@code lockedUntil} and answers {@code LOCKED} until it passes.
 *
 * <p>If the backing store throws, the limiter fails open: the request is allowed and the outage is logged
 * under the {@code SECURITY} marker.
 */
@Slf4j
@Component
public class LoginRateLimiter {

    private final RateLimitStore store;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration window;
    private final int failureWeight;
    private final int lockoutThreshold;
    private final Duration lockout;

    public LoginRateLimiter(RateLimitStore store, RateLimitProperties properties, Clock clock) {
        RateLimitProperties.Login login = properties.getLogin();
        this.store = store;
        this.clock = clock;
        this.maxAttempts = login.getMaxAttempts();
        this.window = Duration.ofSeconds(login.getWindowSeconds());
        this.failureWeight = Math.max(2, login.getFailureWeight());
        this.lockoutThreshold = Math.max(login.getMaxAttempts() + 1, login.getLockoutThreshold());
        this.lockout = Duration.ofSeconds(login.getLockoutSeconds());
    }

    public RateLimitDecision recordAttempt(String identifier) {
        return record(identifier, 1);
    }

    public RateLimitDecision recordFailure(String identifier) {
        return record(identifier, failureWeight);
    }

    /**
     * Current decision for {@code identifier} without counting anything.
     */
    public RateLimitDecision check(String identifier) {
        Instant now = clock.instant();
        try {
            return store.find(identifier)
                    .map(entry -> decide(rollWindow(entry, now), now))
                    .orElseGet(() -> RateLimitDecision.allowed(maxAttempts, maxAttempts));
        } catch (RuntimeException e) {
            log.warn(SecurityMarkers.SECURITY, "Login rate limiter unavailable, failing open for {}: {}",
                    identifier, e.getMessage());
            return RateLimitDecision.allowed(maxAttempts, maxAttempts);
        }
    }

    /**
     * Forgets {@code identifier}; called after a successful login.
     */
    public void clear(String identifier) {
        try {
            store.remove(identifier);
        } catch (RuntimeException e) {
            log.warn(SecurityMarkers.SECURITY, "Failed to clear rate limit entry for {}: {}", identifier, e.getMessage());
        }
    }

    public int sweep() {
        Instant now = clock.instant();
        return store.removeIf(entry -> !entry.isLockedAt(now) && windowElapsed(entry, now));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private RateLimitDecision record(String identifier, int weight) {
        Instant now = clock.instant();
        RateLimitEntry entry;
        try {
            entry = store.update(identifier, current -> apply(identifier, current, weight, now));
        } catch (RuntimeException e) {
            log.warn(SecurityMarkers.SECURITY, "Login rate limiter unavailable, failing open for {}: {}",
                    identifier, e.getMessage());
            return RateLimitDecision.allowed(maxAttempts, maxAttempts);
        }
        RateLimitDecision decision = decide(entry, now);
        if (decision.status() == RateLimitDecision.Status.LOCKED && now.plus(lockout).equals(entry.lockedUntil())) {
            log.warn(SecurityMarkers.SECURITY, "Locked {} for {}s after {} weighted attempts",
                    identifier, lockout.toSeconds(), entry.count());
        } else if (decision.status() == RateLimitDecision.Status.LIMITED) {
            log.info(SecurityMarkers.SECURITY, "Rate limited {} (count={}, retryAfter={}s)",
                    identifier, entry.count(), decision.retryAfterSeconds());
        }
        return decision;
    }

    private RateLimitEntry apply(String identifier, RateLimitEntry current, int weight, Instant now) {
        if (current == null) {
            current = RateLimitEntry.fresh(identifier, now);
        } else if (current.isLockedAt(now)) {
            return current;
        } else if (current.lockedUntil() != null) {
            current = RateLimitEntry.fresh(identifier, now);
        } else {
            current = rollWindow(current, now);
        }
        RateLimitEntry next = current.plus(weight);
        if (next.count() >= lockoutThreshold) {
            next = next.lockUntil(now.plus(lockout));
        }
        return next;
    }

    private RateLimitEntry rollWindow(RateLimitEntry entry, Instant now) {
        if (!entry.isLockedAt(now) && windowElapsed(entry, now)) {
            return RateLimitEntry.fresh(entry.identifier(), now);
        }
        return entry;
    }

    private boolean windowElapsed(RateLimitEntry entry, Instant now) {
        return Duration.between(entry.windowStart(), now).compareTo(window) > 0;
    }

    private RateLimitDecision decide(RateLimitEntry entry, Instant now) {
        if (entry.isLockedAt(now)) {
            return RateLimitDecision.locked(maxAttempts, secondsUntil(now, entry.lockedUntil()));
        }
        if (entry.count() > maxAttempts) {
            return RateLimitDecision.limited(maxAttempts, secondsUntil(now, entry.windowStart().plus(window)));
        }
        return RateLimitDecision.allowed(maxAttempts, maxAttempts - entry.count());
    }

    private static long secondsUntil(Instant now, Instant until) {
        long millis = Duration.between(now, until).toMillis();
        return millis <= 0 ? 1 : (millis + 999) / 1000;
    }
}
