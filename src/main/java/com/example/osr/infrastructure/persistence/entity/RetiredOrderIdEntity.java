package com.example.osr.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Id of a purged order record, kept so the id is never handed out again.
 */
@Entity
@Table(name = "retired_order_ids")
public class RetiredOrderIdEntity {

    @Id
    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "retired_at", nullable = false)
    private Instant retiredAt;

    protected RetiredOrderIdEntity() {
    }

    public RetiredOrderIdEntity(String orderId, Instant retiredAt) {
        this.orderId = orderId;
        this.retiredAt = retiredAt;
    }

    public String getOrderId() {
        return orderId;
    }

    public Instant getRetiredAt() {
        return retiredAt;
    }
}
