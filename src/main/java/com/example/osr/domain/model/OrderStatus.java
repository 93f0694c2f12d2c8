package com.example.osr.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a persisted order record.
 */
public enum OrderStatus {

    /**
     * Finalized document accepted for submission, not yet confirmed by the OSR.
     */
    PENDING,

    /**
     * The OSR confirmed receipt and returned a reference.
     */
    SENT,

    /**
     * The OSR reported the order as processed.
     */
    COMPLETED,

    /**
     * Submission rejected, retries exhausted, or the OSR rejected the order later.
     */
    FAILED,

    /**
     * Cancellation confirmed by the OSR.
     */
    CANCELLED,

    /**
     * Last status refresh could not reach the OSR.
     */
    UNKNOWN;

    /**
     * Returns the states this state may move to.
     */
    public Set<OrderStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(SENT, FAILED);
            case SENT -> EnumSet.of(SENT, COMPLETED, FAILED, CANCELLED, UNKNOWN);
            case UNKNOWN -> EnumSet.of(SENT, COMPLETED, FAILED, CANCELLED, UNKNOWN);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    public boolean canTransitionTo(OrderStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
