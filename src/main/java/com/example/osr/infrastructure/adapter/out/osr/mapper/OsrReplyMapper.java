package com.example.osr.infrastructure.adapter.out.osr.mapper;

import com.example.osr.application.exception.NonRetryableTransportException;
import com.example.osr.application.port.out.OsrTransportPort.RemoteReference;
import com.example.osr.application.port.out.OsrTransportPort.RemoteStatus;
import com.example.osr.infrastructure.adapter.out.osr.dto.OrderReceiptResponse;
import com.example.osr.infrastructure.adapter.out.osr.dto.OrderStatusResponse;
import com.example.osr.infrastructure.adapter.out.osr.dto.ServicePortResponse;
import org.springframework.stereotype.Component;

/**
 * Maps OSR gateway replies to port types. A reply missing its payload is a permanent failure.
 */
@Component
public class OsrReplyMapper {

    public String toEndpoint(String operation, ServicePortResponse response) {
        if (response == null || isBlank(response.endpoint())) {
            throw malformed(operation, "naming service returned no endpoint");
        }
        return stripTrailingSlash(response.endpoint().strip());
    }

    public RemoteReference toReference(String operation, OrderReceiptResponse response) {
        if (response == null || isBlank(response.reference())) {
            throw malformed(operation, "OSR returned no order reference");
        }
        return RemoteReference.of(response.reference().strip());
    }

    public RemoteStatus toStatus(String operation, OrderStatusResponse response) {
        if (response == null || isBlank(response.status())) {
            throw malformed(operation, "OSR returned no order status");
        }
        try {
            return RemoteStatus.valueOf(response.status().strip());
        } catch (IllegalArgumentException e) {
            throw new NonRetryableTransportException(operation, 0,
                    "Malformed OSR reply: unknown order status '" + response.status() + "'", e);
        }
    }

    private static NonRetryableTransportException malformed(String operation, String detail) {
        return new NonRetryableTransportException(operation, 0, "Malformed OSR reply: " + detail);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
