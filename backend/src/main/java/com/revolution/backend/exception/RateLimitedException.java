package com.revolution.backend.exception;

import com.revolution.backend.security.RateLimitDecision;
import lombok.Getter;

@Getter
public class RateLimitedException extends RuntimeException {

    private final RateLimitDecision decision;

    public RateLimitedException(RateLimitDecision decision) {
        super(decision.status() == RateLimitDecision.Status.LOCKED
                ? "Too many failed attempts. Try again later."
                : "Rate limit exceeded");
        this.decision = decision;
    }

    public AuthFailureReason getReason() {
        return decision.status() == RateLimitDecision.Status.LOCKED
                ? AuthFailureReason.LOCKED
                : AuthFailureReason.RATE_LIMITED;
    }
}
