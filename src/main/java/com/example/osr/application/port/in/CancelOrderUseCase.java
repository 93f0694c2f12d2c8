package com.example.osr.application.port.in;

import com.example.osr.application.dto.CancelResult;
import com.example.osr.domain.model.OrderId;

/**
 * Input port for cancelling sent orders.
 */
public interface CancelOrderUseCase {

    CancelResult cancel(OrderId orderId);
}
