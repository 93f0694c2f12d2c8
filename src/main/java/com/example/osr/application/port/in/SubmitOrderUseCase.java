package com.example.osr.application.port.in;

import com.example.osr.application.dto.OrderResult;
import com.example.osr.application.dto.SubmitOrderCommand;
import com.example.osr.domain.document.OrderSpec;
import com.example.osr.domain.model.OrderId;

/**
 * Input port for submitting orders to the OSR.
 */
public interface SubmitOrderUseCase {

    /**
     * Records and transmits a finalized document.
     * Transport failures end in a FAILED record rather than an exception.
     */
    OrderResult submit(SubmitOrderCommand command);

    /**
     * Builds, finalizes and submits the document for an operator spec.
     * Validation failures are thrown before any history is written.
     *
     * @param spec    operator input
     * @param orderId requested id, or null to generate one
     */
    OrderResult submit(OrderSpec spec, OrderId orderId);
}
