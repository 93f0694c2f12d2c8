package com.example.osr.application.port.in;

import com.example.osr.application.dto.HistoryFilter;
import com.example.osr.application.dto.OrderResult;
import com.example.osr.domain.model.OrderId;

import java.util.List;

/**
 * Input port for read-only history views.
 */
public interface OrderQueryUseCase {

    OrderResult get(OrderId orderId);

    List<OrderResult> list(HistoryFilter filter);
}
