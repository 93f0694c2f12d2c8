package com.example.osr.application.exception;

import com.example.osr.domain.model.OrderId;

/**
 * Exception thrown when an id is, or once was, in use in the history.
 */
public class DuplicateOrderIdException extends BusinessException {

    private final OrderId orderId;

    public DuplicateOrderIdException(OrderId orderId) {
        super("DUPLICATE_ID", "Order id already used: " + orderId);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
