package com.example.osr.infrastructure.adapter.in.web.mapper;

import com.example.osr.application.dto.CancelResult;
import com.example.osr.application.dto.HistoryFilter;
import com.example.osr.application.dto.OrderResult;
import com.example.osr.domain.document.OrderSpec;
import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderStatus;
import com.example.osr.infrastructure.adapter.in.web.dto.CancelOrderResponse;
import com.example.osr.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.osr.infrastructure.adapter.in.web.dto.SubmitOrderRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class OrderWebMapper {

    public OrderSpec toSpec(SubmitOrderRequest request) {
        OrderSpec.Builder builder = OrderSpec.builder(request.kind())
                .dryRun(request.dryRun());
        if (request.fields() != null) {
            builder.fields(request.fields());
        }
        if (request.lines() != null) {
            request.lines().forEach(line -> builder.line(line != null ? line : Map.of()));
        }
        return builder.build();
    }

    public OrderId toOrderId(String id) {
        return id == null || id.isBlank() ? null : OrderId.of(id);
    }

    /**
     * @param olderThan ISO-8601 duration; only records last updated before {@code now - olderThan}
     * @param newerThan ISO-8601 duration; only records last updated after {@code now - newerThan}
     * @param osrId     only records addressed to this OSR
     */
    public HistoryFilter toFilter(List<OrderStatus> statuses, String olderThan, String newerThan, String osrId,
                                  Instant now) {
        Instant updatedBefore = olderThan != null ? now.minus(Duration.parse(olderThan)) : null;
        Instant updatedAfter = newerThan != null ? now.minus(Duration.parse(newerThan)) : null;
        return new HistoryFilter(statuses == null ? null : Set.copyOf(statuses), updatedAfter, updatedBefore, osrId);
    }

    public OrderResponse toResponse(OrderResult result) {
        return new OrderResponse(
                result.orderId(),
                result.osrId(),
                result.kind().name(),
                result.documentOrderNumber(),
                result.status().name(),
                result.remoteReference(),
                result.attempts(),
                result.lastError(),
                result.dryRun(),
                result.createdAt(),
                result.lastUpdatedAt(),
                result.document());
    }

    public CancelOrderResponse toResponse(CancelResult result) {
        return new CancelOrderResponse(
                result.outcome().name(),
                result.message(),
                toResponse(result.order()));
    }
}
