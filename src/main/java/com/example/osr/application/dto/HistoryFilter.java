package com.example.osr.application.dto;

import com.example.osr.domain.model.OrderStatus;

import java.time.Instant;
import java.util.Set;

/**
 * Filter for history listings. Empty statuses and null bounds match everything.
 *
 * @param statuses      statuses to include
 * @param updatedAfter  exclusive lower bound on last update time
 * @param updatedBefore exclusive upper bound on last update time
 * @param osrId         only records addressed to this OSR, or null for all
 */
public record HistoryFilter(
        Set<OrderStatus> statuses,
        Instant updatedAfter,
        Instant updatedBefore,
        String osrId
) {
    public HistoryFilter {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        if (updatedAfter != null && updatedBefore != null && !updatedAfter.isBefore(updatedBefore)) {
            throw new IllegalArgumentException("updatedAfter must be before updatedBefore");
        }
        if (osrId != null && osrId.isBlank()) {
            osrId = null;
        }
    }

    public HistoryFilter(Set<OrderStatus> statuses, Instant updatedAfter, Instant updatedBefore) {
        this(statuses, updatedAfter, updatedBefore, null);
    }

    public static HistoryFilter all() {
        return new HistoryFilter(Set.of(), null, null);
    }

    public static HistoryFilter withStatus(OrderStatus... statuses) {
        return new HistoryFilter(Set.of(statuses), null, null);
    }

    public static HistoryFilter forOsr(String osrId) {
        return new HistoryFilter(Set.of(), null, null, osrId);
    }

    public boolean matches(String recordOsrId, OrderStatus status, Instant lastUpdatedAt) {
        if (osrId != null && !osrId.equals(recordOsrId)) {
            return false;
        }
        if (!statuses.isEmpty() && !statuses.contains(status)) {
            return false;
        }
        if (updatedAfter != null && !lastUpdatedAt.isAfter(updatedAfter)) {
            return false;
        }
        return updatedBefore == null || lastUpdatedAt.isBefore(updatedBefore);
    }
}
