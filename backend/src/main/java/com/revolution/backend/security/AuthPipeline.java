package com.revolution.backend.security;

import com.revolution.backend.exception.AuthFailureReason;
import com.revolution.backend.exception.TokenVerificationException;
import com.revolution.backend.service.SecurityMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Per-request bearer authentication. Checks run cheapest first: revocation lookup, signature, claims,
 * and only then the principal store. A token minted before the account's current session generation
 * is treated as revoked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthPipeline {

    private static final String BEARER_PREFIX = "Bearer ";

    private final RevocationStore revocationStore;
    private final TokenCodec tokenCodec;
    private final PrincipalStore principalStore;
    private final SecurityMetrics securityMetrics;

    public AuthOutcome authenticate(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return AuthOutcome.unauthenticated(null);
        }
        String token = extractBearer(authorizationHeader);
        if (token == null) {
            return AuthOutcome.unauthenticated(AuthFailureReason.MALFORMED);
        }

        AuthState state = AuthState.TOKEN_EXTRACTED;
        if (revocationStore.isRevoked(token)) {
            return reject(state, AuthFailureReason.REVOKED, null);
        }

        state = AuthState.REVOCATION_CHECKED;
        TokenClaims claims;
        try {
            claims = tokenCodec.verify(token, TokenType.ACCESS);
        } catch (TokenVerificationException e) {
            AuthState reached = signatureTrusted(e.getReason()) ? AuthState.SIGNATURE_VERIFIED : state;
            return reject(reached, e.getReason(), null);
        }

        state = AuthState.CLAIMS_VALID;
        Long userId = parseSubject(claims.subject());
        if (userId == null) {
            return reject(state, AuthFailureReason.MALFORMED, claims.subject());
        }
        Optional<AccountRecord> account = principalStore.findById(userId);
        if (account.isEmpty()) {
            return reject(state, AuthFailureReason.USER_NOT_FOUND, claims.subject());
        }

        state = AuthState.PRINCIPAL_LOADED;
        if (account.get().isBanned()) {
            return reject(state, AuthFailureReason.USER_BANNED, claims.subject());
        }
        if (claims.tokenVersion() != account.get().tokenVersion()) {
            // issued before the account's last sign-out of all sessions
            return reject(state, AuthFailureReason.REVOKED, claims.subject());
        }
        return AuthOutcome.authenticated(token, claims, account.get().toPrincipal());
    }

    /**
     * Token part of an {@code Authorization: Bearer ...} header, or {@code null} when the header has another shape.
     */
    public static String extractBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private AuthOutcome reject(AuthState lastState, AuthFailureReason reason, String subject) {
        securityMetrics.recordAuthFailure(reason);
        log.debug("Bearer authentication rejected after {}: reason={} subject={}", lastState, reason, subject);
        return AuthOutcome.rejected(lastState, reason);
    }

    private static boolean signatureTrusted(AuthFailureReason reason) {
        return reason != AuthFailureReason.MALFORMED && reason != AuthFailureReason.INVALID_SIGNATURE;
    }

    private static Long parseSubject(String subject) {
        if (subject == null) {
            return null;
        }
        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
