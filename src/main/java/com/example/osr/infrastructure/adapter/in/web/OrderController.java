package com.example.osr.infrastructure.adapter.in.web;

import com.example.osr.application.dto.CancelResult;
import com.example.osr.application.port.in.CancelOrderUseCase;
import com.example.osr.application.port.in.OrderQueryUseCase;
import com.example.osr.application.port.in.PurgeHistoryUseCase;
import com.example.osr.application.port.in.RefreshOrderStatusUseCase;
import com.example.osr.application.port.in.SubmitOrderUseCase;
import com.example.osr.domain.document.OrderSpec;
import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderStatus;
import com.example.osr.infrastructure.adapter.in.web.dto.CancelOrderResponse;
import com.example.osr.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.osr.infrastructure.adapter.in.web.dto.PurgeResponse;
import com.example.osr.infrastructure.adapter.in.web.dto.SubmitOrderRequest;
import com.example.osr.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST controller for order operations.
 * Order operations block on the OSR and the history store, so they run on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "OSR order lifecycle API")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final SubmitOrderUseCase submitOrderUseCase;
    private final CancelOrderUseCase cancelOrderUseCase;
    private final RefreshOrderStatusUseCase refreshOrderStatusUseCase;
    private final OrderQueryUseCase orderQueryUseCase;
    private final PurgeHistoryUseCase purgeHistoryUseCase;
    private final OrderWebMapper mapper;
    private final Clock clock;

    public OrderController(
            SubmitOrderUseCase submitOrderUseCase,
            CancelOrderUseCase cancelOrderUseCase,
            RefreshOrderStatusUseCase refreshOrderStatusUseCase,
            OrderQueryUseCase orderQueryUseCase,
            PurgeHistoryUseCase purgeHistoryUseCase,
            OrderWebMapper mapper,
            Clock clock) {
        this.submitOrderUseCase = submitOrderUseCase;
        this.cancelOrderUseCase = cancelOrderUseCase;
        this.refreshOrderStatusUseCase = refreshOrderStatusUseCase;
        this.orderQueryUseCase = orderQueryUseCase;
        this.purgeHistoryUseCase = purgeHistoryUseCase;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Operation(
            summary = "Submit an order",
            description = """
                    Builds the OSR document for the given kind and fields, records it as PENDING
                    and transmits it. Transient OSR failures are retried with exponential backoff.

                    The returned record is SENT on acceptance and FAILED, with `lastError`,
                    when the OSR rejected the order or retries were exhausted.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Order recorded",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = OrderResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "orderId": "id1",
                                      "osrId": "OSR1",
                                      "kind": "STANDARD",
                                      "orderNumber": "src-pick-1",
                                      "status": "SENT",
                                      "remoteReference": "R-123",
                                      "attempts": 1,
                                      "dryRun": false,
                                      "createdAt": "2026-02-02T12:00:00Z",
                                      "lastUpdatedAt": "2026-02-02T12:00:01Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid order field",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "VALIDATION_ERROR",
                                      "field": "qty",
                                      "message": "Invalid field 'qty': must be a positive integer",
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "409", description = "Order id already used or busy")
    })
    @PostMapping
    public Mono<ResponseEntity<OrderResponse>> submitOrder(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Order submission request",
                    required = true,
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = SubmitOrderRequest.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "id": "id1",
                                      "kind": "STANDARD",
                                      "fields": {
                                        "location": "L01",
                                        "item": "A100",
                                        "qty": "5"
                                      },
                                      "dryRun": false
                                    }
                                    """)
                    )
            )
            @Valid @RequestBody SubmitOrderRequest request) {

        return blocking(() -> {
            log.info("Received {} order request, id: {}, dryRun: {}", request.kind(), request.id(), request.dryRun());
            OrderSpec spec = mapper.toSpec(request);
            OrderResponse response = mapper.toResponse(
                    submitOrderUseCase.submit(spec, mapper.toOrderId(request.id())));
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        });
    }

    @Operation(
            summary = "Cancel an order",
            description = "Requests cancellation at the OSR. Only SENT orders can be cancelled."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order cancelled"),
            @ApiResponse(responseCode = "409", description = "Order not cancellable, or not in SENT status"),
            @ApiResponse(responseCode = "503", description = "OSR unreachable, retry later"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @PostMapping("/{orderId}/cancel")
    public Mono<ResponseEntity<CancelOrderResponse>> cancelOrder(
            @Parameter(description = "Order ID", required = true)
            @PathVariable String orderId) {

        return blocking(() -> {
            CancelResult result = cancelOrderUseCase.cancel(OrderId.of(orderId));
            HttpStatus status = switch (result.outcome()) {
                case CANCELLED -> HttpStatus.OK;
                case RETRY_LATER -> HttpStatus.SERVICE_UNAVAILABLE;
                case NOT_CANCELLABLE -> HttpStatus.CONFLICT;
            };
            return ResponseEntity.status(status).body(mapper.toResponse(result));
        });
    }

    @Operation(summary = "Refresh order status", description = "Re-checks a SENT or UNKNOWN order with the OSR")
    @PostMapping("/{orderId}/status")
    public Mono<OrderResponse> refreshStatus(
            @Parameter(description = "Order ID", required = true)
            @PathVariable String orderId) {
        return blocking(() -> mapper.toResponse(refreshOrderStatusUseCase.refreshStatus(OrderId.of(orderId))));
    }

    @Operation(summary = "Get an order")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/{orderId}")
    public Mono<OrderResponse> getOrder(
            @Parameter(description = "Order ID", required = true)
            @PathVariable String orderId) {
        return blocking(() -> mapper.toResponse(orderQueryUseCase.get(OrderId.of(orderId))));
    }

    @Operation(summary = "List order history", description = "Lists records in submission order")
    @GetMapping
    public Mono<List<OrderResponse>> listOrders(
            @Parameter(description = "Statuses to include")
            @RequestParam(required = false) List<OrderStatus> status,
            @Parameter(description = "Only records last updated longer ago than this ISO-8601 duration", example = "PT24H")
            @RequestParam(required = false) String olderThan,
            @Parameter(description = "Only records last updated within this ISO-8601 duration", example = "PT1H")
            @RequestParam(required = false) String newerThan,
            @Parameter(description = "Only records addressed to this OSR", example = "OSR1")
            @RequestParam(required = false) String osrId) {
        return blocking(() -> orderQueryUseCase.list(
                        mapper.toFilter(status, olderThan, newerThan, osrId, clock.instant()))
                .stream()
                .map(mapper::toResponse)
                .toList());
    }

    @Operation(summary = "Purge order history", description = "Removes records last updated longer ago than the threshold")
    @DeleteMapping
    public Mono<PurgeResponse> purgeHistory(
            @Parameter(description = "ISO-8601 retention threshold", required = true, example = "PT720H")
            @RequestParam String olderThan) {
        return blocking(() -> {
            Duration threshold = Duration.parse(olderThan);
            log.info("Purge requested for records older than {}", threshold);
            return new PurgeResponse(purgeHistoryUseCase.purge(threshold));
        });
    }

    private static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
