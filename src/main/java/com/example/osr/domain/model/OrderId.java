package com.example.osr.domain.model;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Value Object identifying one submission attempt in the order history.
 * Caller-supplied ids are accepted when they match [A-Za-z0-9._-]{1,64}.
 */
public final class OrderId {

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private final String value;

    private OrderId(String value) {
        this.value = Objects.requireNonNull(value, "OrderId value cannot be null");
    }

    /**
     * Creates an OrderId from a caller-supplied token.
     *
     * @param value the id token
     * @return new OrderId instance
     * @throws IllegalArgumentException if value doesn't match [A-Za-z0-9._-]{1,64}
     */
    public static OrderId of(String value) {
        if (value == null || !ID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Invalid OrderId format: " + value + ". Expected pattern: [A-Za-z0-9._-]{1,64}");
        }
        return new OrderId(value);
    }

    /**
     * Generates a new random OrderId.
     *
     * @return new OrderId with random UUID
     */
    public static OrderId generate() {
        return new OrderId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderId orderId = (OrderId) o;
        return Objects.equals(value, orderId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
