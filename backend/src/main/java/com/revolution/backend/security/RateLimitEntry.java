package com.revolution.backend.security;

import java.time.Instant;

/**
 * Attempt counter for one identifier. {@code count} is in weighted units.
 */
public record RateLimitEntry(String identifier, int count, Instant windowStart, Instant lockedUntil) {

    public static RateLimitEntry fresh(String identifier, Instant now) {
        return new RateLimitEntry(identifier, 0, now, null);
    }

    public RateLimitEntry plus(int weight) {
        return new RateLimitEntry(identifier, count + weight, windowStart, lockedUntil);
    }

    public RateLimitEntry lockUntil(Instant until) {
        return new RateLimitEntry(identifier, count, windowStart, until);
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && now.isBefore(lockedUntil);
    }
}
