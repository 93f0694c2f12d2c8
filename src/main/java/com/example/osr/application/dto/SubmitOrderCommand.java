package com.example.osr.application.dto;

import com.example.osr.domain.document.OrderDocument;
import com.example.osr.domain.model.OrderId;

import java.util.Objects;

/**
 * Command for submitting a finalized document.
 *
 * @param orderId  requested id, or null to generate one
 * @param document the finalized document
 * @param dryRun   rehearse without contacting the OSR
 */
public record SubmitOrderCommand(
        OrderId orderId,
        OrderDocument document,
        boolean dryRun
) {
    public SubmitOrderCommand {
        Objects.requireNonNull(document, "Document cannot be null");
    }

    public static SubmitOrderCommand of(OrderDocument document) {
        return new SubmitOrderCommand(null, document, false);
    }
}
