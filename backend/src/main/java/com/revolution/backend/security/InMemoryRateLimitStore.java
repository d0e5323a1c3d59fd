package com.revolution.backend.security;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Single-process {@link RateLimitStore}. Counters are not shared between instances.
 */
@Component
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, RateLimitEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<RateLimitEntry> find(String identifier) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(identifier));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public RateLimitEntry update(String identifier, UnaryOperator<RateLimitEntry> mutation) {
        lock.writeLock().lock();
        try {
            RateLimitEntry updated = mutation.apply(entries.get(identifier));
            if (updated == null) {
                entries.remove(identifier);
            } else {
                entries.put(identifier, updated);
            }
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void remove(String identifier) {
        lock.writeLock().lock();
        try {
            entries.remove(identifier);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int removeIf(Predicate<RateLimitEntry> predicate) {
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(predicate);
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
