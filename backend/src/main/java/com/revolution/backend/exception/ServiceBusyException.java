package com.revolution.backend.exception;

public class ServiceBusyException extends RuntimeException {
    public ServiceBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
