package com.example.osr.domain.exception;

import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderStatus;

/**
 * Exception thrown when an operation is not permitted in the record's current status.
 */
public class InvalidOrderStateException extends DomainException {

    private final OrderId orderId;
    private final OrderStatus currentStatus;

    public InvalidOrderStateException(OrderId orderId, OrderStatus currentStatus, String operation) {
        super(String.format("Cannot %s order %s in status %s", operation, orderId, currentStatus));
        this.orderId = orderId;
        this.currentStatus = currentStatus;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public OrderStatus getCurrentStatus() {
        return currentStatus;
    }
}
