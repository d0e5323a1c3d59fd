package com.revolution.backend.security;

import com.revolution.backend.exception.AuthFailureReason;

/**
 * Result of {@link AuthPipeline#authenticate}. {@code lastState} is the last state reached before a rejection.
 */
public record AuthOutcome(AuthState state,
                          AuthState lastState,
                          AuthFailureReason reason,
                          String token,
                          TokenClaims claims,
                          UserPrincipal principal) {

    static AuthOutcome unauthenticated(AuthFailureReason reason) {
        return new AuthOutcome(AuthState.UNAUTHENTICATED, AuthState.UNAUTHENTICATED, reason, null, null, null);
    }

    static AuthOutcome rejected(AuthState lastState, AuthFailureReason reason) {
        return new AuthOutcome(AuthState.REJECTED, lastState, reason, null, null, null);
    }

    static AuthOutcome authenticated(String token, TokenClaims claims, UserPrincipal principal) {
        return new AuthOutcome(AuthState.AUTHENTICATED, AuthState.PRINCIPAL_LOADED, null, token, claims, principal);
    }

    public boolean isAuthenticated() {
        return state == AuthState.AUTHENTICATED;
    }
}
