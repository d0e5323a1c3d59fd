package com.revolution.backend.service;

import com.revolution.backend.security.LoginRateLimiter;
import com.revolution.backend.security.RevocationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically prunes expired revocation entries, idle rate-limit windows and idle throttles.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SecurityStateSweeper {

    private final RevocationStore revocationStore;
    private final LoginRateLimiter loginRateLimiter;
    private final ThrottleService throttleService;

    @Scheduled(fixedDelayString = "${revolution.security.sweep-interval-ms:60000}")
    public void sweep() {
        int revoked = revocationStore.sweep();
        int limits = loginRateLimiter.sweep();
        int throttles = throttleService.evictIdle();
        if (revoked + limits + throttles > 0) {
            log.debug("Security state sweep removed revocations={} rateLimits={} throttles={}",
                    revoked, limits, throttles);
        }
    }
}
