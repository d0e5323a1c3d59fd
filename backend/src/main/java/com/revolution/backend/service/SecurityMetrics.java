package com.revolution.backend.service;

import com.revolution.backend.exception.AuthFailureReason;
import com.revolution.backend.security.RateLimitDecision;
import com.revolution.backend.security.RevocationStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SecurityMetrics {

    private final MeterRegistry meterRegistry;
    private final RevocationStore revocationStore;

    private Counter tokensRevokedCounter;

    @PostConstruct
    void init() {
        tokensRevokedCounter = Counter.builder("tokens_revoked_total").register(meterRegistry);
        Gauge.builder("revoked_tokens_tracked", revocationStore, RevocationStore::size).register(meterRegistry);
    }

    public void recordAuthFailure(AuthFailureReason reason) {
        meterRegistry.counter("auth_failures_total", "reason", reason.name()).increment();
    }

    public void recordRateLimitRejection(RateLimitDecision.Status status) {
        meterRegistry.counter("rate_limit_rejections_total", "status", status.name()).increment();
    }

    public void recordRevocation() {
        if (tokensRevokedCounter != null) {
            tokensRevokedCounter.increment();
        }
    }
}
