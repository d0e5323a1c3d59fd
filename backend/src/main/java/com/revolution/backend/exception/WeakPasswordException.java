package com.revolution.backend.exception;

public class WeakPasswordException extends BadRequestException {
    public WeakPasswordException(String message) {
        super(message);
    }
}
