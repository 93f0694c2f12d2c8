package com.example.osr.application.service;

import com.example.osr.application.dto.CancelResult;
import com.example.osr.application.dto.HistoryFilter;
import com.example.osr.application.dto.OrderResult;
import com.example.osr.application.dto.SubmitOrderCommand;
import com.example.osr.application.exception.ForeignOsrOrderException;
import com.example.osr.application.exception.OrderNotFoundException;
import com.example.osr.application.exception.StorageException;
import com.example.osr.application.exception.TransportException;
import com.example.osr.application.port.in.CancelOrderUseCase;
import com.example.osr.application.port.in.OrderQueryUseCase;
import com.example.osr.application.port.in.RefreshOrderStatusUseCase;
import com.example.osr.application.port.in.SubmitOrderUseCase;
import com.example.osr.application.port.out.HistoryStorePort;
import com.example.osr.application.port.out.OsrTransportPort;
import com.example.osr.application.port.out.OsrTransportPort.RemoteReference;
import com.example.osr.application.port.out.OsrTransportPort.RemoteStatus;
import com.example.osr.domain.document.OrderDocument;
import com.example.osr.domain.document.OrderDocumentBuilder;
import com.example.osr.domain.document.OrderSpec;
import com.example.osr.domain.exception.InvalidOrderStateException;
import com.example.osr.domain.exception.OrderValidationException;
import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderRecord;
import com.example.osr.domain.model.OrderStatus;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Application service that drives an order through its lifecycle.
 * Coordinates the document builder, the OSR transport and the history store.
 * All state-changing operations for one order id are serialized through {@link OrderLockRegistry}.
 */
@Service
public class OrderLifecycleService implements
        SubmitOrderUseCase, CancelOrderUseCase, RefreshOrderStatusUseCase, OrderQueryUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    static final String DRY_RUN_REFERENCE_PREFIX = "DRYRUN-";

    private final OrderDocumentBuilder documentBuilder;
    private final CatalogCheck catalogCheck;
    private final OsrTransportPort transport;
    private final HistoryStorePort history;
    private final OrderLockRegistry locks;
    private final Retry submitRetry;
    private final LifecycleSettings settings;
    private final Clock clock;

    public OrderLifecycleService(
            OrderDocumentBuilder documentBuilder,
            CatalogCheck catalogCheck,
            OsrTransportPort transport,
            HistoryStorePort history,
            OrderLockRegistry locks,
            Retry submitRetry,
            LifecycleSettings settings,
            Clock clock) {
        this.documentBuilder = documentBuilder;
        this.catalogCheck = catalogCheck;
        this.transport = transport;
        this.history = history;
        this.locks = locks;
        this.submitRetry = submitRetry;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public OrderResult submit(OrderSpec spec, OrderId orderId) {
        OrderDocument draft = documentBuilder.build(spec);
        catalogCheck.verify(spec);
        OrderDocument document = draft.finalizeDocument();
        log.debug("Built {} document {}", document.getKind(), document.getOrderNumber());
        return submit(new SubmitOrderCommand(orderId, document, spec.isDryRun()));
    }

    @Override
    public OrderResult submit(SubmitOrderCommand command) {
        OrderDocument document = command.document();
        if (!document.isFinalized()) {
            throw new OrderValidationException("document", "must be finalized before submission");
        }
        OrderId orderId = command.orderId() != null ? command.orderId() : OrderId.generate();
        boolean dryRun = command.dryRun() || settings.dryRun();

        return locks.withLock(orderId, () -> {
            history.append(OrderRecord.pending(orderId, settings.osrId(), document, dryRun, clock.instant()));
            log.info("Order {} recorded as PENDING: osr={}, kind={}, orderNumber={}, dryRun={}",
                    orderId, settings.osrId(), document.getKind(), document.getOrderNumber(), dryRun);

            OrderRecord result = dryRun ? rehearse(orderId) : transmit(orderId, document);
            return OrderResult.from(result);
        });
    }

    private OrderRecord rehearse(OrderId orderId) {
        OrderRecord sent = history.update(orderId, record -> record.markSent(DRY_RUN_REFERENCE_PREFIX + orderId));
        log.info("Order {} dry run, not transmitted", orderId);
        return sent;
    }

    private OrderRecord transmit(OrderId orderId, OrderDocument document) {
        RemoteReference reference;
        try {
            reference = submitRetry.executeSupplier(() -> {
                OrderRecord attempting = history.update(orderId, OrderRecord::recordAttempt);
                log.debug("Sending order {} attempt {}", orderId, attempting.getAttempts());
                return transport.send(document, settings.callTimeout());
            });
        } catch (TransportException e) {
            String reason = describeSendFailure(e);
            OrderRecord failed = history.update(orderId, record -> record.markFailed(reason));
            log.warn("Order {} FAILED after {} attempt(s): {}", orderId, failed.getAttempts(), reason);
            return failed;
        }

        OrderRecord sent;
        try {
            sent = history.update(orderId, record -> record.markSent(reference.value()));
        } catch (StorageException e) {
            log.error("Order {} was accepted by OSR {} as {} but could not be recorded as SENT; "
                    + "the record stays PENDING and must be reconciled by hand", orderId, settings.osrId(),
                    reference.value(), e);
            throw e;
        }
        log.info("Order {} SENT: reference={}, attempts={}", orderId, reference.value(), sent.getAttempts());
        return sent;
    }

    private static String describeSendFailure(TransportException e) {
        if (e.isTransient()) {
            return "Transient failure, retries exhausted: " + e.getMessage();
        }
        return "Rejected: " + e.getMessage();
    }

    @Override
    public CancelResult cancel(OrderId orderId) {
        return locks.withLock(orderId, () -> {
            OrderRecord current = require(orderId);
            if (current.getStatus() != OrderStatus.SENT) {
                throw new InvalidOrderStateException(orderId, current.getStatus(), "cancel");
            }
            requireConfiguredOsr(current);

            if (current.isDryRun()) {
                OrderRecord cancelled = history.update(orderId, OrderRecord::markCancelled);
                log.info("Order {} CANCELLED locally (dry run)", orderId);
                return CancelResult.cancelled(OrderResult.from(cancelled));
            }

            try {
                transport.cancel(RemoteReference.of(current.getRemoteReference()), settings.callTimeout());
            } catch (TransportException e) {
                OrderRecord unchanged = history.update(orderId, record -> record.recordError(e.getMessage()));
                if (e.isTransient()) {
                    log.warn("Cancellation of order {} failed transiently: {}", orderId, e.getMessage());
                    return CancelResult.retryLater(OrderResult.from(unchanged), e.getMessage());
                }
                log.warn("Order {} is not cancellable: {}", orderId, e.getMessage());
                return CancelResult.notCancellable(OrderResult.from(unchanged), e.getMessage());
            }

            OrderRecord cancelled = history.update(orderId, OrderRecord::markCancelled);
            log.info("Order {} CANCELLED", orderId);
            return CancelResult.cancelled(OrderResult.from(cancelled));
        });
    }

    @Override
    public OrderResult refreshStatus(OrderId orderId) {
        return locks.withLock(orderId, () -> {
            OrderRecord current = require(orderId);
            if (current.getStatus() != OrderStatus.SENT && current.getStatus() != OrderStatus.UNKNOWN) {
                throw new InvalidOrderStateException(orderId, current.getStatus(), "refresh status of");
            }
            requireConfiguredOsr(current);
            if (current.isDryRun()) {
                return OrderResult.from(current);
            }

            RemoteStatus remote;
            try {
                remote = transport.queryStatus(RemoteReference.of(current.getRemoteReference()), settings.callTimeout());
            } catch (TransportException e) {
                OrderRecord unknown = history.update(orderId, record -> record.markUnknown(e.getMessage()));
                log.warn("Status of order {} is UNKNOWN: {}", orderId, e.getMessage());
                return OrderResult.from(unknown);
            }

            OrderStatus target = toOrderStatus(remote);
            if (target == current.getStatus()) {
                log.debug("Order {} unchanged: remote status {}", orderId, remote);
                return OrderResult.from(current);
            }
            OrderRecord refreshed = history.update(orderId, transitionFor(target));
            log.info("Order {} {} -> {} (remote status {})", orderId, current.getStatus(), target, remote);
            return OrderResult.from(refreshed);
        });
    }

    static OrderStatus toOrderStatus(RemoteStatus remote) {
        return switch (remote) {
            case ACCEPTED, IN_PROGRESS -> OrderStatus.SENT;
            case COMPLETED -> OrderStatus.COMPLETED;
            case CANCELLED -> OrderStatus.CANCELLED;
            case REJECTED -> OrderStatus.FAILED;
        };
    }

    private static Consumer<OrderRecord> transitionFor(OrderStatus target) {
        return switch (target) {
            case SENT -> OrderRecord::confirmSent;
            case COMPLETED -> OrderRecord::markCompleted;
            case CANCELLED -> OrderRecord::markCancelled;
            case FAILED -> record -> record.markFailed("Rejected by OSR");
            default -> throw new IllegalStateException("No remote transition to " + target);
        };
    }

    @Override
    public OrderResult get(OrderId orderId) {
        return OrderResult.from(require(orderId));
    }

    @Override
    public List<OrderResult> list(HistoryFilter filter) {
        return history.list(filter).stream()
                .map(OrderResult::from)
                .toList();
    }

    private void requireConfiguredOsr(OrderRecord record) {
        if (!settings.osrId().equals(record.getOsrId())) {
            throw new ForeignOsrOrderException(record.getId(), record.getOsrId(), settings.osrId());
        }
    }

    private OrderRecord require(OrderId orderId) {
        return history.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
