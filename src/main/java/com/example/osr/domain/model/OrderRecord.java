package com.example.osr.domain.model;

import com.example.osr.domain.document.OrderDocument;
import com.example.osr.domain.exception.InvalidOrderStateException;

import java.time.Instant;
import java.util.Objects;

/**
 * Aggregate Root holding the lifecycle state of one submission attempt.
 * Instances are owned by the history store; callers mutate them only inside a store update.
 */
public final class OrderRecord {

    private final OrderId id;
    private final String osrId;
    private final OrderKind kind;
    private final String document;
    private final String documentOrderNumber;
    private final Instant createdAt;
    private final boolean dryRun;
    private OrderStatus status;
    private Instant lastUpdatedAt;
    private String remoteReference;
    private int attempts;
    private String lastError;

    private OrderRecord(OrderId id, String osrId, OrderKind kind, String document, String documentOrderNumber,
                        OrderStatus status, Instant createdAt, Instant lastUpdatedAt,
                        String remoteReference, int attempts, String lastError, boolean dryRun) {
        this.id = Objects.requireNonNull(id, "OrderId cannot be null");
        this.osrId = Objects.requireNonNull(osrId, "OsrId cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.document = Objects.requireNonNull(document, "Document cannot be null");
        this.documentOrderNumber = Objects.requireNonNull(documentOrderNumber, "DocumentOrderNumber cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.lastUpdatedAt = Objects.requireNonNull(lastUpdatedAt, "LastUpdatedAt cannot be null");
        this.remoteReference = remoteReference;
        this.attempts = attempts;
        this.lastError = lastError;
        this.dryRun = dryRun;

        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative: " + attempts);
        }
    }

    /**
     * Creates a new PENDING record for a finalized document.
     *
     * @param id       the record id
     * @param osrId    the OSR the order is addressed to
     * @param document the finalized document to snapshot
     * @param dryRun   whether the submission is a rehearsal
     * @param now      creation timestamp
     * @return new OrderRecord in PENDING status with zero attempts
     * @throws IllegalArgumentException if the document is not finalized
     */
    public static OrderRecord pending(OrderId id, String osrId, OrderDocument document, boolean dryRun, Instant now) {
        Objects.requireNonNull(document, "Document cannot be null");
        if (!document.isFinalized()) {
            throw new IllegalArgumentException("Only finalized documents can be recorded for submission");
        }
        return new OrderRecord(id, osrId, document.getKind(), document.toXml(), document.getOrderNumber(),
                OrderStatus.PENDING, now, now, null, 0, null, dryRun);
    }

    /**
     * Reconstitutes a record from persistence.
     */
    public static OrderRecord reconstitute(OrderId id, String osrId, OrderKind kind, String document, String documentOrderNumber,
                                           OrderStatus status, Instant createdAt, Instant lastUpdatedAt,
                                           String remoteReference, int attempts, String lastError, boolean dryRun) {
        return new OrderRecord(id, osrId, kind, document, documentOrderNumber, status, createdAt, lastUpdatedAt,
                remoteReference, attempts, lastError, dryRun);
    }

    /**
     * Counts one transmission attempt.
     *
     * @throws InvalidOrderStateException if the record is not PENDING
     */
    public void recordAttempt() {
        if (status != OrderStatus.PENDING) {
            throw new InvalidOrderStateException(id, status, "attempt transmission of");
        }
        attempts++;
    }

    /**
     * Marks the order as accepted by the OSR.
     *
     * @param reference the correlation reference returned by the OSR
     */
    public void markSent(String reference) {
        Objects.requireNonNull(reference, "Remote reference cannot be null");
        transitionTo(OrderStatus.SENT, "mark as sent");
        this.remoteReference = reference;
        this.lastError = null;
    }

    /**
     * Confirms a previously sent order is still live at the OSR.
     * Recovers an UNKNOWN record; the remote reference is kept.
     */
    public void confirmSent() {
        requireReference("confirm");
        transitionTo(OrderStatus.SENT, "confirm");
        this.lastError = null;
    }

    public void markCompleted() {
        requireReference("complete");
        transitionTo(OrderStatus.COMPLETED, "complete");
        this.lastError = null;
    }

    public void markFailed(String reason) {
        transitionTo(OrderStatus.FAILED, "fail");
        this.lastError = reason;
    }

    public void markCancelled() {
        transitionTo(OrderStatus.CANCELLED, "cancel");
        this.lastError = null;
    }

    /**
     * Marks the remote state as unknown after a failed status query.
     * The remote reference is retained so a later refresh can recover.
     */
    public void markUnknown(String reason) {
        requireReference("mark as unknown");
        transitionTo(OrderStatus.UNKNOWN, "mark as unknown");
        this.lastError = reason;
    }

    /**
     * Records a non-terminal error without changing the status.
     */
    public void recordError(String reason) {
        this.lastError = reason;
    }

    /**
     * Stamps the last update time. Called by the history store on every write.
     */
    public void touch(Instant now) {
        Objects.requireNonNull(now, "Timestamp cannot be null");
        this.lastUpdatedAt = now;
    }

    public boolean isStaleAt(Instant cutoff) {
        return lastUpdatedAt.isBefore(cutoff);
    }

    private void transitionTo(OrderStatus next, String operation) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidOrderStateException(id, status, operation);
        }
        this.status = next;
    }

    private void requireReference(String operation) {
        if (remoteReference == null) {
            throw new InvalidOrderStateException(id, status, operation);
        }
    }

    public OrderId getId() {
        return id;
    }

    public String getOsrId() {
        return osrId;
    }

    public OrderKind getKind() {
        return kind;
    }

    public String getDocument() {
        return document;
    }

    public String getDocumentOrderNumber() {
        return documentOrderNumber;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public String getRemoteReference() {
        return remoteReference;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderRecord that = (OrderRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "OrderRecord{" +
                "id=" + id +
                ", osrId=" + osrId +
                ", kind=" + kind +
                ", status=" + status +
                ", attempts=" + attempts +
                ", remoteReference=" + remoteReference +
                '}';
    }
}
