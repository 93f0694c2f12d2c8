package com.example.osr.application.port.in;

import com.example.osr.application.dto.OrderResult;
import com.example.osr.domain.model.OrderId;

/**
 * Input port for re-checking an order's OSR-side state.
 */
public interface RefreshOrderStatusUseCase {

    OrderResult refreshStatus(OrderId orderId);
}
