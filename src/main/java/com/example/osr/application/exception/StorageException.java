package com.example.osr.application.exception;

/**
 * Exception thrown when the history store cannot durably commit a change.
 * The operation is aborted and the store keeps its last committed state.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
