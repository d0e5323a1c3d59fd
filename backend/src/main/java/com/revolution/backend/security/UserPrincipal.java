package com.revolution.backend.security;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.security.Principal;

/**
 * Account bound to the security context once a bearer token has passed {@link AuthPipeline}.
 */
@Getter
@ToString
@AllArgsConstructor
public class UserPrincipal implements Principal {

    private final Long userId;
    private final String email;
    private final String role;
    private final boolean mfaEnabled;

    @Override
    public String getName() {
        return String.valueOf(userId);
    }
}
