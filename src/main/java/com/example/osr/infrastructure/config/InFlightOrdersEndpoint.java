package com.example.osr.infrastructure.config;

import com.example.osr.application.service.OrderLockRegistry;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator endpoint exposing the number of orders with an operation in progress.
 */
@Component
@Endpoint(id = "inflightorders")
public class InFlightOrdersEndpoint {

    private final OrderLockRegistry locks;

    public InFlightOrdersEndpoint(OrderLockRegistry locks) {
        this.locks = locks;
    }

    @ReadOperation
    public Map<String, Object> inFlightOrders() {
        int active = locks.activeCount();
        return Map.of(
                "inFlightOrders", active,
                "status", active > 0 ? "BUSY" : "IDLE"
        );
    }
}
