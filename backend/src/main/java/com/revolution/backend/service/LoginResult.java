package com.revolution.backend.service;

import com.revolution.backend.dto.AuthResponse;
import com.revolution.backend.dto.MfaRequiredResponse;

/**
 * Either issued tokens or a request for the second factor; exactly one side is set.
 */
public record LoginResult(AuthResponse tokens, MfaRequiredResponse mfaChallenge) {

    public static LoginResult issued(AuthResponse tokens) {
        return new LoginResult(tokens, null);
    }

    public static LoginResult mfaRequired(String message) {
        return new LoginResult(null, MfaRequiredResponse.builder().message(message).build());
    }

    public boolean isMfaRequired() {
        return mfaChallenge != null;
    }
}
