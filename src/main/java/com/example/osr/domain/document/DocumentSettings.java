package com.example.osr.domain.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Site-wide inputs to document building: the order number prefix and the
 * compartment capacity specs announced with goods-in orders.
 */
public record DocumentSettings(
        String orderPrefix,
        Map<String, Integer> capacitySpecs
) {
    private static final Pattern PREFIX_PATTERN = Pattern.compile("^[A-Za-z0-9_]{1,16}$");

    public static final String DEFAULT_PREFIX = "src";

    public DocumentSettings {
        Objects.requireNonNull(orderPrefix, "OrderPrefix cannot be null");
        if (!PREFIX_PATTERN.matcher(orderPrefix).matches()) {
            throw new IllegalArgumentException("Invalid order prefix: " + orderPrefix);
        }
        capacitySpecs = capacitySpecs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(capacitySpecs));
        capacitySpecs.forEach((type, max) -> {
            if (max == null || max <= 0) {
                throw new IllegalArgumentException("Capacity for compartment type " + type + " must be positive");
            }
        });
    }

    public static DocumentSettings defaults() {
        return new DocumentSettings(DEFAULT_PREFIX, Map.of());
    }
}
