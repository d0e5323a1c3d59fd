package com.revolution.backend.security;

import java.time.Instant;

/**
 * Payload of a bearer token. Times are epoch seconds, as on the wire.
 *
 * @param tokenVersion the account's session generation at issue time; bumping it on the account
 *                     invalidates every token issued before
 */
public record TokenClaims(
        String subject,
        String email,
        String role,
        long issuedAt,
        long expiresAt,
        String issuer,
        String audience,
        TokenType tokenType,
        String tokenId,
        int tokenVersion) {

    public Instant expiresAtInstant() {
        return Instant.ofEpochSecond(expiresAt);
    }

    public Instant issuedAtInstant() {
        return Instant.ofEpochSecond(issuedAt);
    }
}
