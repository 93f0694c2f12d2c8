package com.example.osr.application.exception;

/**
 * Base class for failures talking to the OSR.
 */
public abstract class TransportException extends RuntimeException {

    private final String operation;
    private final int statusCode;

    protected TransportException(String operation, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    /**
     * Whether repeating the call may succeed.
     */
    public abstract boolean isTransient();

    public String getOperation() {
        return operation;
    }

    /**
     * HTTP status returned by the gateway, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
