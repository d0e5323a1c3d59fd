package com.revolution.backend.security;

public record RateLimitDecision(Status status, int limit, int remaining, long retryAfterSeconds) {

    public enum Status {
        ALLOWED,
        LIMITED,
        LOCKED
    }

    public static RateLimitDecision allowed(int limit, int remaining) {
        return new RateLimitDecision(Status.ALLOWED, limit, Math.max(0, remaining), 0);
    }

    public static RateLimitDecision limited(int limit, long retryAfterSeconds) {
        return new RateLimitDecision(Status.LIMITED, limit, 0, Math.max(1, retryAfterSeconds));
    }

    public static RateLimitDecision locked(int limit, long retryAfterSeconds) {
        return new RateLimitDecision(Status.LOCKED, limit, 0, Math.max(1, retryAfterSeconds));
    }

    public boolean isAllowed() {
        return status == Status.ALLOWED;
    }
}
