package com.example.osr.application.exception;

/**
 * Exception for OSR failures that should trigger a retry.
 * Typically thrown for connection drops, timeouts and 5xx gateway replies.
 */
public class RetryableTransportException extends TransportException {

    public RetryableTransportException(String operation, int statusCode, String message) {
        super(operation, statusCode, message, null);
    }

    public RetryableTransportException(String operation, String message, Throwable cause) {
        super(operation, 0, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
