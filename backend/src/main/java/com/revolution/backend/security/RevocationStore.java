package com.revolution.backend.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local denylist of tokens revoked before their natural expiry.
 *
 * <p>Entries are keyed by the SHA-256 of the raw token and live no longer than the token itself.
 * Lookups share a read lock; {@link #revoke} and {@link #sweep} take the write lock.
 */
@Slf4j
@Component
public class RevocationStore {

    private final Map<String, Instant> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public RevocationStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Revokes {@code token} for {@code remainingTtl}. A token with no validity left needs no entry.
     *
     * @return {@code true} when this call revoked the token, {@code false} when it was already revoked
     *         or nothing was recorded
     */
    public boolean revoke(String token, Duration remainingTtl) {
        if (token == null || remainingTtl == null || remainingTtl.isZero() || remainingTtl.isNegative()) {
            return false;
        }
        String identifier = identifier(token);
        Instant now = clock.instant();
        Instant expiresAt = now.plus(remainingTtl);
        boolean inserted;
        lock.writeLock().lock();
        try {
            Instant current = entries.get(identifier);
            inserted = current == null || !current.isAfter(now);
            if (inserted || current.isBefore(expiresAt)) {
                entries.put(identifier, expiresAt);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (inserted) {
            log.debug("Revoked token id={} until {}", shortId(identifier), expiresAt);
        }
        return inserted;
    }

    /**
     * An entry past its expiry counts as absent; it stays in the map until the next {@link #sweep}.
     */
    public boolean isRevoked(String token) {
        if (token == null) {
            return false;
        }
        String identifier = identifier(token);
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            Instant expiresAt = entries.get(identifier);
            return expiresAt != null && expiresAt.isAfter(now);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, Instant>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                if (!iterator.next().getValue().isAfter(now)) {
                    iterator.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("Swept {} expired revocation entries", removed);
        }
        return removed;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public static String identifier(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to hash token", e);
        }
    }

    public static String shortId(String identifier) {
        return identifier.length() > 12 ? identifier.substring(0, 12) : identifier;
    }
}
