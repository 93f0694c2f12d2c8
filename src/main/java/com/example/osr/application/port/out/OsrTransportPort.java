package com.example.osr.application.port.out;

import com.example.osr.domain.document.OrderDocument;

import java.time.Duration;
import java.util.Objects;

/**
 * Output port for talking to the OSR control system.
 * All calls block until the OSR answers or the timeout elapses; implementations never retry internally.
 *
 * @see com.example.osr.application.exception.RetryableTransportException
 * @see com.example.osr.application.exception.NonRetryableTransportException
 */
public interface OsrTransportPort {

    /**
     * Transmits a finalized document.
     *
     * @param document the document to send
     * @param timeout  upper bound for the call
     * @return the OSR correlation reference
     */
    RemoteReference send(OrderDocument document, Duration timeout);

    /**
     * Requests cancellation of a previously sent order.
     */
    CancellationAck cancel(RemoteReference reference, Duration timeout);

    /**
     * Queries the OSR-side state of a previously sent order.
     */
    RemoteStatus queryStatus(RemoteReference reference, Duration timeout);

    record RemoteReference(String value) {
        public RemoteReference {
            Objects.requireNonNull(value, "Reference cannot be null");
            if (value.isBlank()) {
                throw new IllegalArgumentException("Reference cannot be blank");
            }
        }

        public static RemoteReference of(String value) {
            return new RemoteReference(value);
        }
    }

    record CancellationAck(RemoteReference reference) {
    }

    enum RemoteStatus {
        ACCEPTED,
        IN_PROGRESS,
        COMPLETED,
        CANCELLED,
        REJECTED
    }
}
