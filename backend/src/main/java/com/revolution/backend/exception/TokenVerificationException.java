package com.revolution.backend.exception;

public class TokenVerificationException extends AuthenticationFailedException {

    public TokenVerificationException(AuthFailureReason reason) {
        super(reason);
    }
}
