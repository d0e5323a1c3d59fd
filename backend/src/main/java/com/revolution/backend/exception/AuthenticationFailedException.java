package com.revolution.backend.exception;

import lombok.Getter;

@Getter
public class AuthenticationFailedException extends RuntimeException {

    private final AuthFailureReason reason;

    public AuthenticationFailedException(AuthFailureReason reason) {
        super(reason.name());
        this.reason = reason;
    }

    public AuthenticationFailedException(AuthFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
