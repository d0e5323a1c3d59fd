package com.revolution.backend.exception;

/**
 * Internal reason codes for authentication failures. Logged and counted, never echoed to clients
 * (except {@link #USER_BANNED}, {@link #RATE_LIMITED} and {@link #LOCKED}).
 */
public enum AuthFailureReason {
    MALFORMED,
    INVALID_SIGNATURE,
    EXPIRED,
    ISSUER_MISMATCH,
    AUDIENCE_MISMATCH,
    WRONG_TOKEN_TYPE,
    REVOKED,
    UNKNOWN_HASH_FORMAT,
    INVALID_CREDENTIALS,
    USER_NOT_FOUND,
    USER_BANNED,
    RATE_LIMITED,
    LOCKED,
    MFA_REQUIRED,
    MFA_INVALID
}
