package com.example.osr.domain.exception;

/**
 * Exception thrown when operator input does not satisfy the schema of its order kind.
 * Carries the first offending field in declared schema order.
 */
public class OrderValidationException extends DomainException {

    private final String field;
    private final String reason;

    public OrderValidationException(String field, String reason) {
        super(String.format("Invalid field '%s': %s", field, reason));
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
