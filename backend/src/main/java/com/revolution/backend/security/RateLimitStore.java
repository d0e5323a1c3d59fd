package com.revolution.backend.security;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Backing store for {@link LoginRateLimiter}. {@link #update} must apply the mutation atomically per identifier.
 */
public interface RateLimitStore {

    Optional<RateLimitEntry> find(String identifier);

    /**
     * Applies {@code mutation} to the current entry ({@code null} when absent) and stores the result.
     */
    RateLimitEntry update(String identifier, UnaryOperator<RateLimitEntry> mutation);

    void remove(String identifier);

    int removeIf(Predicate<RateLimitEntry> predicate);
}
