package com.revolution.backend.security;

import java.time.Instant;

/**
 * Read-only view of an account as the auth core needs it.
 */
public record AccountRecord(Long id,
                            String email,
                            String role,
                            Instant bannedAt,
                            String credentialHash,
                            boolean mfaEnabled,
                            int tokenVersion) {

    public boolean isBanned() {
        return bannedAt != null;
    }

    public UserPrincipal toPrincipal() {
        return new UserPrincipal(id, email, role, mfaEnabled);
    }
}
