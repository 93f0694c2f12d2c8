package com.example.osr.infrastructure.adapter.in.web.dto;

import com.example.osr.domain.model.OrderKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for submitting an order via REST API.
 *
 * @param id     requested order id; generated when absent
 * @param kind   order kind
 * @param fields header fields, or the single line of a pick order without explicit lines
 * @param lines  pick order lines
 * @param dryRun record the order without sending it to the OSR
 */
public record SubmitOrderRequest(
        @Pattern(regexp = "^[A-Za-z0-9._-]{1,64}$", message = "Invalid order id format")
        String id,

        @NotNull(message = "Order kind is required")
        OrderKind kind,

        Map<String, String> fields,

        List<Map<String, String>> lines,

        boolean dryRun
) {}
