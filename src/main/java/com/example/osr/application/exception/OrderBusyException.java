package com.example.osr.application.exception;

import com.example.osr.domain.model.OrderId;

/**
 * Exception thrown when another operation already holds the order's lock.
 * Contending requests are rejected, never queued.
 */
public class OrderBusyException extends BusinessException {

    private final OrderId orderId;

    public OrderBusyException(OrderId orderId) {
        super("BUSY", "Order " + orderId + " has another operation in progress");
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
