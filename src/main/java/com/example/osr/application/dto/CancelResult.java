package com.example.osr.application.dto;

/**
 * Result of a cancellation request.
 */
public record CancelResult(
        CancelOutcome outcome,
        OrderResult order,
        String message
) {
    public enum CancelOutcome {
        CANCELLED,
        RETRY_LATER,
        NOT_CANCELLABLE
    }

    public static CancelResult cancelled(OrderResult order) {
        return new CancelResult(CancelOutcome.CANCELLED, order, "Order cancelled");
    }

    public static CancelResult retryLater(OrderResult order, String reason) {
        return new CancelResult(CancelOutcome.RETRY_LATER, order, reason);
    }

    public static CancelResult notCancellable(OrderResult order, String reason) {
        return new CancelResult(CancelOutcome.NOT_CANCELLABLE, order, reason);
    }
}
