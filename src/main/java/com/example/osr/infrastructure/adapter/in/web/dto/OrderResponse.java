package com.example.osr.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Response DTO describing an order record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderResponse(
        String orderId,
        String osrId,
        String kind,
        String orderNumber,
        String status,
        String remoteReference,
        int attempts,
        String lastError,
        boolean dryRun,
        Instant createdAt,
        Instant lastUpdatedAt,
        String document
) {}
