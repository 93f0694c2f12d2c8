package com.example.osr.infrastructure.adapter.in.web.dto;

/**
 * Response DTO for a cancellation request.
 */
public record CancelOrderResponse(
        String outcome,
        String message,
        OrderResponse order
) {}
