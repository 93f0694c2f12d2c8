package com.example.osr.application.exception;

import com.example.osr.domain.model.OrderId;

/**
 * Exception thrown when an order was submitted to a different OSR than the one this service talks to.
 * Such records stay readable but cannot be cancelled or refreshed from here.
 */
public class ForeignOsrOrderException extends BusinessException {

    private final OrderId orderId;
    private final String recordOsrId;

    public ForeignOsrOrderException(OrderId orderId, String recordOsrId, String configuredOsrId) {
        super("OSR_MISMATCH", "Order " + orderId + " was sent to OSR " + recordOsrId
                + ", not to the configured OSR " + configuredOsrId);
        this.orderId = orderId;
        this.recordOsrId = recordOsrId;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public String getRecordOsrId() {
        return recordOsrId;
    }
}
