package com.example.osr.infrastructure.persistence.entity;

import com.example.osr.domain.model.OrderKind;
import com.example.osr.domain.model.OrderStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA Entity for order history records.
 * The sequence column preserves insertion order.
 */
@Entity
@Table(name = "order_records", indexes = {
        @Index(name = "idx_order_records_status", columnList = "status"),
        @Index(name = "idx_order_records_updated", columnList = "last_updated_at"),
        @Index(name = "idx_order_records_osr", columnList = "osr_id")
})
public class OrderRecordEntity {

    public static final int LAST_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seq")
    private Long seq;

    @Column(name = "order_id", length = 64, nullable = false, unique = true)
    private String orderId;

    @Column(name = "osr_id", length = 64, nullable = false)
    private String osrId;

    @Column(name = "kind", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderKind kind;

    @Column(name = "document", length = 65535, nullable = false)
    private String document;

    @Column(name = "document_order_number", length = 64, nullable = false)
    private String documentOrderNumber;

    @Column(name = "status", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "remote_reference", length = 128)
    private String remoteReference;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = OrderRecordEntity.LAST_ERROR_LENGTH)
    private String lastError;

    @Column(name = "dry_run", nullable = false)
    private boolean dryRun;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    public Long getSeq() {
        return seq;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getOsrId() {
        return osrId;
    }

    public void setOsrId(String osrId) {
        this.osrId = osrId;
    }

    public OrderKind getKind() {
        return kind;
    }

    public void setKind(OrderKind kind) {
        this.kind = kind;
    }

    public String getDocument() {
        return document;
    }

    public void setDocument(String document) {
        this.document = document;
    }

    public String getDocumentOrderNumber() {
        return documentOrderNumber;
    }

    public void setDocumentOrderNumber(String documentOrderNumber) {
        this.documentOrderNumber = documentOrderNumber;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public void setStatus(OrderStatus status) {
        this.status = status;
    }

    public String getRemoteReference() {
        return remoteReference;
    }

    public void setRemoteReference(String remoteReference) {
        this.remoteReference = remoteReference;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public void setLastUpdatedAt(Instant lastUpdatedAt) {
        this.lastUpdatedAt = lastUpdatedAt;
    }
}
