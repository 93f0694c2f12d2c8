package com.example.osr.application.exception;

import com.example.osr.domain.model.OrderId;

/**
 * Exception thrown when no history record exists for an id.
 */
public class OrderNotFoundException extends BusinessException {

    private final OrderId orderId;

    public OrderNotFoundException(OrderId orderId) {
        super("NOT_FOUND", "Order not found: " + orderId);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
