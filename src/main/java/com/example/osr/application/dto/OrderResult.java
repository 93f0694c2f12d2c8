package com.example.osr.application.dto;

import com.example.osr.domain.model.OrderKind;
import com.example.osr.domain.model.OrderRecord;
import com.example.osr.domain.model.OrderStatus;

import java.time.Instant;

/**
 * Read-only snapshot of an order record.
 */
public record OrderResult(
        String orderId,
        String osrId,
        OrderKind kind,
        String documentOrderNumber,
        OrderStatus status,
        String remoteReference,
        int attempts,
        String lastError,
        boolean dryRun,
        Instant createdAt,
        Instant lastUpdatedAt,
        String document
) {
    public static OrderResult from(OrderRecord record) {
        return new OrderResult(
                record.getId().getValue(),
                record.getOsrId(),
                record.getKind(),
                record.getDocumentOrderNumber(),
                record.getStatus(),
                record.getRemoteReference(),
                record.getAttempts(),
                record.getLastError(),
                record.isDryRun(),
                record.getCreatedAt(),
                record.getLastUpdatedAt(),
                record.getDocument()
        );
    }
}
