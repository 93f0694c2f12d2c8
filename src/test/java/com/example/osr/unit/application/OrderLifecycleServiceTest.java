package com.example.osr.unit.application;

import com.example.osr.application.dto.CancelResult;
import com.example.osr.application.dto.CancelResult.CancelOutcome;
import com.example.osr.application.dto.HistoryFilter;
import com.example.osr.application.dto.OrderResult;
import com.example.osr.application.dto.SubmitOrderCommand;
import com.example.osr.application.exception.DuplicateOrderIdException;
import com.example.osr.application.exception.ForeignOsrOrderException;
import com.example.osr.application.exception.NonRetryableTransportException;
import com.example.osr.application.exception.OrderBusyException;
import com.example.osr.application.exception.OrderNotFoundException;
import com.example.osr.application.exception.RetryableTransportException;
import com.example.osr.application.exception.StorageException;
import com.example.osr.application.port.out.CatalogLookupPort;
import com.example.osr.application.port.out.OsrTransportPort;
import com.example.osr.application.port.out.OsrTransportPort.CancellationAck;
import com.example.osr.application.port.out.OsrTransportPort.RemoteReference;
import com.example.osr.application.port.out.OsrTransportPort.RemoteStatus;
import com.example.osr.application.service.CatalogCheck;
import com.example.osr.application.service.LifecycleSettings;
import com.example.osr.application.service.OrderLifecycleService;
import com.example.osr.application.service.OrderLockRegistry;
import com.example.osr.domain.document.DocumentSettings;
import com.example.osr.domain.document.OrderDocument;
import com.example.osr.domain.document.OrderDocumentBuilder;
import com.example.osr.domain.document.OrderSpec;
import com.example.osr.domain.exception.InvalidOrderStateException;
import com.example.osr.domain.exception.OrderValidationException;
import com.example.osr.domain.model.OrderId;
import com.example.osr.domain.model.OrderKind;
import com.example.osr.domain.model.OrderRecord;
import com.example.osr.domain.model.OrderStatus;
import com.example.osr.support.InMemoryHistoryStore;
import com.example.osr.support.MutableClock;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the order lifecycle engine: submission, retry, cancellation and status refresh.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Order Lifecycle Service Tests")
class OrderLifecycleServiceTest {

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(2);
    private static final OrderId ID1 = OrderId.of("id1");
    private static final String OSR_ID = "OSR1";

    @Mock
    private OsrTransportPort transport;

    @Mock
    private CatalogLookupPort catalog;

    private MutableClock clock;
    private InMemoryHistoryStore history;
    private OrderLockRegistry locks;
    private OrderDocumentBuilder documentBuilder;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-02T12:00:00Z"));
        history = new InMemoryHistoryStore(clock);
        locks = new OrderLockRegistry();
        documentBuilder = new OrderDocumentBuilder(DocumentSettings.defaults());
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private OrderLifecycleService service(boolean globalDryRun) {
        return service(globalDryRun, new CatalogCheck(Optional.empty()));
    }

    private OrderLifecycleService service(boolean globalDryRun, CatalogCheck catalogCheck) {
        Retry retry = Retry.of("osrSubmit", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(10))
                .retryExceptions(RetryableTransportException.class)
                .ignoreExceptions(NonRetryableTransportException.class)
                .build());
        return new OrderLifecycleService(documentBuilder, catalogCheck, transport, history, locks, retry,
                new LifecycleSettings(OSR_ID, CALL_TIMEOUT, globalDryRun), clock);
    }

    private OrderLifecycleService service() {
        return service(false);
    }

    private static OrderSpec standardSpec() {
        return OrderSpec.builder(OrderKind.STANDARD)
                .field("item", "A100")
                .field("qty", "5")
                .field("location", "L01")
                .build();
    }

    private OrderDocument standardDocument() {
        return documentBuilder.build(standardSpec()).finalizeDocument();
    }

    private OrderResult submitSent(OrderLifecycleService service, OrderId orderId, String reference) {
        when(transport.send(any(), eq(CALL_TIMEOUT))).thenReturn(RemoteReference.of(reference));
        return service.submit(new SubmitOrderCommand(orderId, standardDocument(), false));
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("should_send_standard_order_and_record_reference")
        void should_send_standard_order_and_record_reference() {
            // Given: the record must be durably PENDING with one attempt while the send is in progress
            OrderLifecycleService service = service();
            when(transport.send(any(), eq(CALL_TIMEOUT))).thenAnswer(invocation -> {
                assertThat(history.get(ID1)).hasValueSatisfying(record -> {
                    assertThat(record.getStatus()).isEqualTo(OrderStatus.PENDING);
                    assertThat(record.getAttempts()).isEqualTo(1);
                });
                return RemoteReference.of("R-123");
            });

            // When
            OrderResult result = service.submit(standardSpec(), ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.remoteReference()).isEqualTo("R-123");
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.documentOrderNumber()).isEqualTo("src-pick-1");
            assertThat(result.osrId()).isEqualTo(OSR_ID);
            assertThat(result.lastError()).isNull();
            verify(transport, times(1)).send(any(), eq(CALL_TIMEOUT));
        }

        @Test
        @DisplayName("should_generate_id_when_none_given")
        void should_generate_id_when_none_given() {
            // Given
            OrderLifecycleService service = service();
            when(transport.send(any(), any())).thenReturn(RemoteReference.of("R-9"));

            // When
            OrderResult result = service.submit(SubmitOrderCommand.of(standardDocument()));

            // Then
            assertThat(result.orderId()).isNotBlank();
            assertThat(history.get(OrderId.of(result.orderId()))).isPresent();
        }

        @Test
        @DisplayName("should_record_dry_run_without_contacting_osr")
        void should_record_dry_run_without_contacting_osr() {
            // Given
            OrderLifecycleService service = service();

            // When
            OrderResult result = service.submit(new SubmitOrderCommand(ID1, standardDocument(), true));

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.remoteReference()).isEqualTo("DRYRUN-id1");
            assertThat(result.attempts()).isZero();
            assertThat(result.dryRun()).isTrue();
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("should_honour_global_dry_run_setting")
        void should_honour_global_dry_run_setting() {
            // Given
            OrderLifecycleService service = service(true);

            // When
            OrderResult result = service.submit(standardSpec(), ID1);

            // Then
            assertThat(result.dryRun()).isTrue();
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("should_retry_transient_failure_and_succeed")
        void should_retry_transient_failure_and_succeed() {
            // Given
            OrderLifecycleService service = service();
            when(transport.send(any(), any()))
                    .thenThrow(new RetryableTransportException("send", 503, "unavailable"))
                    .thenReturn(RemoteReference.of("R-2"));

            // When
            OrderResult result = service.submit(standardSpec(), ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.attempts()).isEqualTo(2);
            verify(transport, times(2)).send(any(), any());
        }

        @Test
        @DisplayName("should_fail_after_retry_ceiling_on_persistent_transient_failure")
        void should_fail_after_retry_ceiling_on_persistent_transient_failure() {
            // Given
            OrderLifecycleService service = service();
            when(transport.send(any(), any()))
                    .thenThrow(new RetryableTransportException("send", 503, "OSR gateway returned 503"));

            // When
            OrderResult result = service.submit(standardSpec(), ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.FAILED);
            assertThat(result.attempts()).isEqualTo(3);
            assertThat(result.lastError()).contains("retries exhausted").contains("503");
            verify(transport, times(3)).send(any(), any());
        }

        @Test
        @DisplayName("should_fail_immediately_on_permanent_rejection")
        void should_fail_immediately_on_permanent_rejection() {
            // Given
            OrderLifecycleService service = service();
            when(transport.send(any(), any()))
                    .thenThrow(new NonRetryableTransportException("send", 422, "schema violation"));

            // When
            OrderResult result = service.submit(standardSpec(), ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.FAILED);
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.lastError()).contains("schema violation");
            verify(transport, times(1)).send(any(), any());
        }

        @Test
        @DisplayName("should_not_touch_history_on_validation_error")
        void should_not_touch_history_on_validation_error() {
            // Given
            OrderLifecycleService service = service();
            OrderSpec invalid = OrderSpec.builder(OrderKind.STANDARD)
                    .field("item", "A100")
                    .field("qty", "-5")
                    .field("location", "L01")
                    .build();

            // When & Then
            assertThatThrownBy(() -> service.submit(invalid, ID1))
                    .isInstanceOf(OrderValidationException.class);
            assertThat(history.list(HistoryFilter.all())).isEmpty();
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("should_reject_draft_document")
        void should_reject_draft_document() {
            // Given
            OrderLifecycleService service = service();
            OrderDocument draft = documentBuilder.build(standardSpec());

            // When & Then
            assertThatThrownBy(() -> service.submit(new SubmitOrderCommand(ID1, draft, false)))
                    .isInstanceOf(OrderValidationException.class)
                    .hasMessageContaining("finalized");
            assertThat(history.get(ID1)).isEmpty();
        }

        @Test
        @DisplayName("should_reject_resubmission_under_same_id_even_after_failure")
        void should_reject_resubmission_under_same_id_even_after_failure() {
            // Given
            OrderLifecycleService service = service();
            when(transport.send(any(), any()))
                    .thenThrow(new NonRetryableTransportException("send", 400, "bad order"));
            service.submit(standardSpec(), ID1);

            // When & Then
            assertThatThrownBy(() -> service.submit(standardSpec(), ID1))
                    .isInstanceOf(DuplicateOrderIdException.class);
            verify(transport, times(1)).send(any(), any());
        }

        @Test
        @DisplayName("should_reject_concurrent_submission_for_same_id_as_busy")
        void should_reject_concurrent_submission_for_same_id_as_busy() throws Exception {
            // Given: the first submission blocks inside the OSR call
            OrderLifecycleService service = service();
            CountDownLatch release = new CountDownLatch(1);
            when(transport.send(any(), any())).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return RemoteReference.of("R-1");
            });
            SubmitOrderCommand command = new SubmitOrderCommand(ID1, standardDocument(), false);
            Future<OrderResult> first = executor.submit(() -> service.submit(command));
            await().atMost(Duration.ofSeconds(5)).until(() -> locks.activeCount() == 1);

            // When & Then: a second submission for the same id is rejected
            assertThatThrownBy(() -> service.submit(command))
                    .isInstanceOf(OrderBusyException.class);

            // And: another id proceeds in parallel
            Future<OrderResult> other = executor.submit(() ->
                    service.submit(new SubmitOrderCommand(OrderId.of("id2"), standardDocument(), true)));
            assertThat(other.get(5, TimeUnit.SECONDS).status()).isEqualTo(OrderStatus.SENT);

            release.countDown();
            OrderResult result = first.get(5, TimeUnit.SECONDS);
            assertThat(result.status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.attempts()).isEqualTo(1);
            verify(transport, times(1)).send(any(), any());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("should_cancel_sent_order")
        void should_cancel_sent_order() {
            // Given
            OrderLifecycleService service = service();
            submitSent(service, ID1, "R-123");
            when(transport.cancel(RemoteReference.of("R-123"), CALL_TIMEOUT))
                    .thenReturn(new CancellationAck(RemoteReference.of("R-123")));

            // When
            CancelResult result = service.cancel(ID1);

            // Then
            assertThat(result.outcome()).isEqualTo(CancelOutcome.CANCELLED);
            assertThat(result.order().status()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(service.get(ID1).status()).isEqualTo(OrderStatus.CANCELLED);
        }

        @Test
        @DisplayName("should_reject_cancel_of_failed_order_without_contacting_osr")
        void should_reject_cancel_of_failed_order_without_contacting_osr() {
            // Given
            OrderLifecycleService service = service();
            when(transport.send(any(), any()))
                    .thenThrow(new NonRetryableTransportException("send", 400, "bad order"));
            service.submit(standardSpec(), ID1);

            // When & Then
            assertThatThrownBy(() -> service.cancel(ID1))
                    .isInstanceOf(InvalidOrderStateException.class)
                    .hasMessageContaining("FAILED");
            verify(transport, never()).cancel(any(), any());
        }

        @Test
        @DisplayName("should_keep_order_sent_and_ask_to_retry_on_transient_failure")
        void should_keep_order_sent_and_ask_to_retry_on_transient_failure() {
            // Given
            OrderLifecycleService service = service();
            submitSent(service, ID1, "R-123");
            when(transport.cancel(any(), any()))
                    .thenThrow(new RetryableTransportException("cancel", "connection refused", null));

            // When
            CancelResult result = service.cancel(ID1);

            // Then
            assertThat(result.outcome()).isEqualTo(CancelOutcome.RETRY_LATER);
            assertThat(result.order().status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.order().lastError()).contains("connection refused");
        }

        @Test
        @DisplayName("should_report_not_cancellable_distinctly_on_permanent_failure")
        void should_report_not_cancellable_distinctly_on_permanent_failure() {
            // Given
            OrderLifecycleService service = service();
            submitSent(service, ID1, "R-123");
            when(transport.cancel(any(), any()))
                    .thenThrow(new NonRetryableTransportException("cancel", 409, "already processed"));

            // When
            CancelResult result = service.cancel(ID1);

            // Then
            assertThat(result.outcome()).isEqualTo(CancelOutcome.NOT_CANCELLABLE);
            assertThat(result.order().status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.message()).contains("already processed");
        }

        @Test
        @DisplayName("should_cancel_dry_run_order_locally")
        void should_cancel_dry_run_order_locally() {
            // Given
            OrderLifecycleService service = service();
            service.submit(new SubmitOrderCommand(ID1, standardDocument(), true));

            // When
            CancelResult result = service.cancel(ID1);

            // Then
            assertThat(result.outcome()).isEqualTo(CancelOutcome.CANCELLED);
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("should_report_unknown_id")
        void should_report_unknown_id() {
            // When & Then
            assertThatThrownBy(() -> service().cancel(OrderId.of("missing")))
                    .isInstanceOf(OrderNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Status Refresh")
    class StatusRefresh {

        @Test
        @DisplayName("should_mark_completed_when_osr_reports_completion")
        void should_mark_completed_when_osr_reports_completion() {
            // Given
            OrderLifecycleService service = service();
            submitSent(service, ID1, "R-123");
            when(transport.queryStatus(RemoteReference.of("R-123"), CALL_TIMEOUT)).thenReturn(RemoteStatus.COMPLETED);

            // When
            OrderResult result = service.refreshStatus(ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.COMPLETED);
        }

        @Test
        @DisplayName("should_mark_unknown_and_keep_reference_when_osr_unreachable")
        void should_mark_unknown_and_keep_reference_when_osr_unreachable() {
            // Given
            OrderLifecycleService service = service();
            submitSent(service, ID1, "R-123");
            when(transport.queryStatus(any(), any()))
                    .thenThrow(new RetryableTransportException("status", "timed out", null));

            // When
            OrderResult result = service.refreshStatus(ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.UNKNOWN);
            assertThat(result.remoteReference()).isEqualTo("R-123");
            assertThat(result.lastError()).contains("timed out");
        }

        @Test
        @DisplayName("should_recover_unknown_order_on_successful_refresh")
        void should_recover_unknown_order_on_successful_refresh() {
            // Given
            OrderLifecycleService service = service();
            submitSent(service, ID1, "R-123");
            when(transport.queryStatus(any(), any()))
                    .thenThrow(new RetryableTransportException("status", "timed out", null))
                    .thenReturn(RemoteStatus.IN_PROGRESS);
            service.refreshStatus(ID1);

            // When
            OrderResult result = service.refreshStatus(ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.lastError()).isNull();
        }

        @Test
        @DisplayName("should_mark_failed_when_osr_rejected_order")
        void should_mark_failed_when_osr_rejected_order() {
            // Given
            OrderLifecycleService service = service();
            submitSent(service, ID1, "R-123");
            when(transport.queryStatus(any(), any())).thenReturn(RemoteStatus.REJECTED);

            // When
            OrderResult result = service.refreshStatus(ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.FAILED);
        }

        @Test
        @DisplayName("should_leave_record_untouched_when_status_unchanged")
        void should_leave_record_untouched_when_status_unchanged() {
            // Given
            OrderLifecycleService service = service();
            OrderResult sent = submitSent(service, ID1, "R-123");
            when(transport.queryStatus(any(), any())).thenReturn(RemoteStatus.ACCEPTED);
            clock.advance(Duration.ofHours(1));

            // When
            OrderResult result = service.refreshStatus(ID1);

            // Then
            assertThat(result.status()).isEqualTo(OrderStatus.SENT);
            assertThat(result.lastUpdatedAt()).isEqualTo(sent.lastUpdatedAt());
        }

        @Test
        @DisplayName("should_reject_refresh_of_cancelled_order")
        void should_reject_refresh_of_cancelled_order() {
            // Given
            OrderLifecycleService service = service();
            service.submit(new SubmitOrderCommand(ID1, standardDocument(), true));
            service.cancel(ID1);

            // When & Then
            assertThatThrownBy(() -> service.refreshStatus(ID1))
                    .isInstanceOf(InvalidOrderStateException.class);
            verifyNoInteractions(transport);
        }
    }

    @Nested
    @DisplayName("History Queries")
    class HistoryQueries {

        @Test
        @DisplayName("should_list_orders_by_status_in_submission_order")
        void should_list_orders_by_status_in_submission_order() {
            // Given
            OrderLifecycleService service = service();
            service.submit(new SubmitOrderCommand(OrderId.of("a"), standardDocument(), true));
            service.submit(new SubmitOrderCommand(OrderId.of("b"), standardDocument(), true));
            service.submit(new SubmitOrderCommand(OrderId.of("c"), standardDocument(), true));
            service.cancel(OrderId.of("b"));

            // When
            var sent = service.list(HistoryFilter.withStatus(OrderStatus.SENT));

            // Then
            assertThat(sent).extracting(OrderResult::orderId).containsExactly("a", "c");
        }
    }

    @Nested
    @DisplayName("Catalog Validation")
    class CatalogValidation {

        private OrderLifecycleService serviceWithCatalog() {
            return service(false, new CatalogCheck(Optional.of(catalog)));
        }

        @Test
        @DisplayName("should_report_earlier_schema_field_before_unknown_product_code")
        void should_report_earlier_schema_field_before_unknown_product_code() {
            // Given: location is missing and the item is not in the catalog
            OrderSpec spec = OrderSpec.builder(OrderKind.STANDARD)
                    .field("item", "Z999")
                    .field("qty", "5")
                    .build();

            // When & Then
            assertThatThrownBy(() -> serviceWithCatalog().submit(spec, ID1))
                    .isInstanceOfSatisfying(OrderValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("location"));
            verifyNoInteractions(catalog, transport);
        }

        @Test
        @DisplayName("should_report_malformed_code_as_format_error")
        void should_report_malformed_code_as_format_error() {
            // Given
            OrderSpec spec = OrderSpec.builder(OrderKind.STANDARD)
                    .field("item", "bad code!")
                    .field("qty", "5")
                    .field("location", "L01")
                    .build();

            // When & Then
            assertThatThrownBy(() -> serviceWithCatalog().submit(spec, ID1))
                    .isInstanceOfSatisfying(OrderValidationException.class, e -> {
                        assertThat(e.getField()).isEqualTo("item");
                        assertThat(e.getReason()).doesNotContain("unknown product code");
                    });
            verifyNoInteractions(catalog);
        }

        @Test
        @DisplayName("should_reject_unknown_product_code_without_recording")
        void should_reject_unknown_product_code_without_recording() {
            // Given
            when(catalog.lookup("Z999")).thenReturn(Optional.empty());
            OrderSpec spec = OrderSpec.builder(OrderKind.STANDARD)
                    .field("item", "Z999")
                    .field("qty", "5")
                    .field("location", "L01")
                    .build();

            // When & Then
            assertThatThrownBy(() -> serviceWithCatalog().submit(spec, ID1))
                    .isInstanceOfSatisfying(OrderValidationException.class, e -> {
                        assertThat(e.getField()).isEqualTo("item");
                        assertThat(e.getReason()).isEqualTo("unknown product code Z999");
                    });
            assertThat(history.get(ID1)).isEmpty();
            verifyNoInteractions(transport);
        }
    }

    @Nested
    @DisplayName("Storage Failures")
    class StorageFailures {

        @Test
        @DisplayName("should_abort_before_sending_when_attempt_cannot_be_recorded")
        void should_abort_before_sending_when_attempt_cannot_be_recorded() {
            // Given
            OrderLifecycleService service = service();
            history.failUpdatesWhere(record ->
                    record.getStatus() == OrderStatus.PENDING && record.getAttempts() > 0);

            // When & Then
            assertThatThrownBy(() -> service.submit(standardSpec(), ID1))
                    .isInstanceOf(StorageException.class);
            verify(transport, never()).send(any(), any());
            assertThat(history.get(ID1)).hasValueSatisfying(record -> {
                assertThat(record.getStatus()).isEqualTo(OrderStatus.PENDING);
                assertThat(record.getAttempts()).isZero();
            });
        }

        @Test
        @DisplayName("should_not_report_sent_when_acceptance_cannot_be_recorded")
        void should_not_report_sent_when_acceptance_cannot_be_recorded() {
            // Given
            OrderLifecycleService service = service();
            when(transport.send(any(), any())).thenReturn(RemoteReference.of("R-7"));
            history.failUpdatesWhere(record -> record.getStatus() == OrderStatus.SENT);

            // When & Then
            assertThatThrownBy(() -> service.submit(standardSpec(), ID1))
                    .isInstanceOf(StorageException.class);
            verify(transport, times(1)).send(any(), any());
            assertThat(history.get(ID1)).hasValueSatisfying(record -> {
                assertThat(record.getStatus()).isEqualTo(OrderStatus.PENDING);
                assertThat(record.getAttempts()).isEqualTo(1);
                assertThat(record.getRemoteReference()).isNull();
            });
            assertThat(locks.activeCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Records of Another OSR")
    class RecordsOfAnotherOsr {

        private void recordSentToOtherOsr() {
            history.append(OrderRecord.reconstitute(ID1, "OSR2", OrderKind.STANDARD, "<host2osr/>", "src-pick-1",
                    OrderStatus.SENT, clock.instant(), clock.instant(), "R-9", 1, null, false));
        }

        @Test
        @DisplayName("should_refuse_to_cancel_order_of_another_osr")
        void should_refuse_to_cancel_order_of_another_osr() {
            // Given
            recordSentToOtherOsr();

            // When & Then
            assertThatThrownBy(() -> service().cancel(ID1))
                    .isInstanceOfSatisfying(ForeignOsrOrderException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo("OSR_MISMATCH");
                        assertThat(e.getRecordOsrId()).isEqualTo("OSR2");
                    });
            assertThat(history.get(ID1).orElseThrow().getStatus()).isEqualTo(OrderStatus.SENT);
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("should_refuse_to_refresh_order_of_another_osr")
        void should_refuse_to_refresh_order_of_another_osr() {
            // Given
            recordSentToOtherOsr();

            // When & Then
            assertThatThrownBy(() -> service().refreshStatus(ID1))
                    .isInstanceOf(ForeignOsrOrderException.class);
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("should_list_orders_per_osr")
        void should_list_orders_per_osr() {
            // Given
            recordSentToOtherOsr();
            service().submit(new SubmitOrderCommand(OrderId.of("id2"), standardDocument(), true));

            // When & Then
            assertThat(service().list(HistoryFilter.forOsr(OSR_ID)))
                    .extracting(OrderResult::orderId)
                    .containsExactly("id2");
            assertThat(service().list(HistoryFilter.forOsr("OSR2")))
                    .extracting(OrderResult::orderId)
                    .containsExactly("id1");
            assertThat(service().get(ID1).osrId()).isEqualTo("OSR2");
        }
    }
}
