package com.revolution.backend.security;

import com.revolution.backend.config.RateLimitProperties;
import com.revolution.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LoginRateLimiterTest {

    private MutableClock clock;
    private InMemoryRateLimitStore store;
    private RateLimitProperties properties;
    private LoginRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryRateLimitStore();
        properties = new RateLimitProperties();
        properties.getLogin().setMaxAttempts(5);
        properties.getLogin().setWindowSeconds(60);
        properties.getLogin().setFailureWeight(2);
        properties.getLogin().setLockoutThreshold(10);
        properties.getLogin().setLockoutSeconds(900);
        limiter = new LoginRateLimiter(store, properties, clock);
    }

    @Test
    void sixthAttemptInsideWindowIsLimitedAndWindowResetAllowsAgain() {
        for (int i = 1; i <= 5; i++) {
            RateLimitDecision decision = limiter.recordAttempt("ip:10.0.0.1");
            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.remaining()).isEqualTo(5 - i);
            clock.advance(Duration.ofSeconds(5));
        }

        RateLimitDecision sixth = limiter.recordAttempt("ip:10.0.0.1");
        assertThat(sixth.status()).isEqualTo(RateLimitDecision.Status.LIMITED);
        assertThat(sixth.retryAfterSeconds()).isGreaterThan(0).isLessThanOrEqualTo(60);

        clock.advance(Duration.ofSeconds(61));
        RateLimitDecision afterWindow = limiter.recordAttempt("ip:10.0.0.1");
        assertThat(afterWindow.isAllowed()).isTrue();
        assertThat(afterWindow.remaining()).isEqualTo(4);
    }

    @Test
    void windowBoundaryIsExclusive() {
        for (int i = 0; i < 6; i++) {
            limiter.recordAttempt("ip:10.0.0.2");
        }
        clock.advance(Duration.ofSeconds(60));

        assertThat(limiter.recordAttempt("ip:10.0.0.2").status()).isEqualTo(RateLimitDecision.Status.LIMITED);
    }

    @Test
    void failuresEscalateToLockoutFasterThanAttempts() {
        assertThat(limiter.recordFailure("account:a@b.c").isAllowed()).isTrue();
        assertThat(limiter.recordFailure("account:a@b.c").isAllowed()).isTrue();
        assertThat(limiter.recordFailure("account:a@b.c").status()).isEqualTo(RateLimitDecision.Status.LIMITED);
        assertThat(limiter.recordFailure("account:a@b.c").status()).isEqualTo(RateLimitDecision.Status.LIMITED);

        RateLimitDecision locked = limiter.recordFailure("account:a@b.c");
        assertThat(locked.status()).isEqualTo(RateLimitDecision.Status.LOCKED);
        assertThat(locked.retryAfterSeconds()).isEqualTo(900);
    }

    @Test
    void lockOutlastsTheWindowAndExpires() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure("account:a@b.c");
        }

        clock.advance(Duration.ofMinutes(5));
        RateLimitDecision stillLocked = limiter.recordAttempt("account:a@b.c");
        assertThat(stillLocked.status()).isEqualTo(RateLimitDecision.Status.LOCKED);
        assertThat(stillLocked.retryAfterSeconds()).isEqualTo(600);
        assertThat(limiter.check("account:a@b.c").status()).isEqualTo(RateLimitDecision.Status.LOCKED);

        clock.advance(Duration.ofSeconds(601));
        RateLimitDecision afterLock = limiter.recordAttempt("account:a@b.c");
        assertThat(afterLock.isAllowed()).isTrue();
        assertThat(afterLock.remaining()).isEqualTo(4);
    }

    @Test
    void checkDoesNotCount() {
        for (int i = 0; i < 20; i++) {
            assertThat(limiter.check("ip:10.0.0.3").isAllowed()).isTrue();
        }
        assertThat(limiter.recordAttempt("ip:10.0.0.3").remaining()).isEqualTo(4);
    }

    @Test
    void clearForgetsPriorFailures() {
        limiter.recordFailure("account:a@b.c");
        limiter.recordFailure("account:a@b.c");
        limiter.recordFailure("account:a@b.c");
        assertThat(limiter.check("account:a@b.c").isAllowed()).isFalse();

        limiter.clear("account:a@b.c");

        assertThat(limiter.check("account:a@b.c").isAllowed()).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    void identifiersAreIndependent() {
        for (int i = 0; i < 6; i++) {
            limiter.recordAttempt("ip:10.0.0.4");
        }

        assertThat(limiter.recordAttempt("ip:10.0.0.5").isAllowed()).isTrue();
    }

    @Test
    void sweepDropsIdleEntriesButKeepsLocks() {
        limiter.recordAttempt("ip:idle");
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure("account:locked");
        }
        clock.advance(Duration.ofSeconds(120));

        assertThat(limiter.sweep()).isEqualTo(1);
        assertThat(store.find("ip:idle")).isEmpty();
        assertThat(store.find("account:locked")).isPresent();
    }

    @Test
    void unavailableStoreFailsOpen() {
        RateLimitStore broken = mock(RateLimitStore.class);
        when(broken.update(anyString(), any())).thenThrow(new IllegalStateException("store down"));
        when(broken.find(anyString())).thenThrow(new IllegalStateException("store down"));
        LoginRateLimiter failOpen = new LoginRateLimiter(broken, properties, clock);

        assertThat(failOpen.recordAttempt("ip:10.0.0.6").isAllowed()).isTrue();
        assertThat(failOpen.recordFailure("ip:10.0.0.6").isAllowed()).isTrue();
        assertThat(failOpen.check("ip:10.0.0.6").isAllowed()).isTrue();
    }

    @Test
    void misconfiguredWeightsAreRaisedToSafeMinimums() {
        properties.getLogin().setFailureWeight(0);
        properties.getLogin().setLockoutThreshold(1);
        LoginRateLimiter guarded = new LoginRateLimiter(new InMemoryRateLimitStore(), properties, clock);

        // threshold raised to maxAttempts + 1, weight to 2
        guarded.recordFailure("ip:x");
        guarded.recordFailure("ip:x");
        assertThat(guarded.recordFailure("ip:x").status()).isEqualTo(RateLimitDecision.Status.LOCKED);
    }
}
