package com.example.osr.application.exception;

/**
 * Exception for OSR failures that should NOT trigger a retry.
 * Typically thrown for schema rejections, authorization failures and orders the OSR will not cancel.
 */
public class NonRetryableTransportException extends TransportException {

    public NonRetryableTransportException(String operation, int statusCode, String message) {
        super(operation, statusCode, message, null);
    }

    public NonRetryableTransportException(String operation, int statusCode, String message, Throwable cause) {
        super(operation, statusCode, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
