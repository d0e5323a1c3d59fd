package com.revolution.backend.exception;

/**
 * A stored credential whose prefix matches no supported hash format. Distinct from a password mismatch.
 */
public class UnknownHashFormatException extends RuntimeException {
    public UnknownHashFormatException(String message) {
        super(message);
    }
}
