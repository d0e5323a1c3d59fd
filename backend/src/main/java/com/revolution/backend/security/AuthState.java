package com.revolution.backend.security;

/**
 * Request authentication states, in transition order. {@link #REJECTED} and {@link #AUTHENTICATED} are terminal,
 * as is {@link #UNAUTHENTICATED} when no usable bearer header was sent.
 */
public enum AuthState {
    UNAUTHENTICATED,
    TOKEN_EXTRACTED,
    REVOCATION_CHECKED,
    SIGNATURE_VERIFIED,
    CLAIMS_VALID,
    PRINCIPAL_LOADED,
    AUTHENTICATED,
    REJECTED
}
