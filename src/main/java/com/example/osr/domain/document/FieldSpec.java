package com.example.osr.domain.document;

import java.util.Map;
import java.util.Objects;

/**
 * Declaration of one schema field: name, type and how an absent value is resolved.
 */
public record FieldSpec(
        String name,
        FieldType type,
        boolean required,
        String defaultValue,
        String defaultFromField
) {
    public FieldSpec {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, true, null, null);
    }

    public static FieldSpec optional(String name, FieldType type, String defaultValue) {
        return new FieldSpec(name, type, false, defaultValue, null);
    }

    /**
     * Optional field that falls back to the resolved value of another field.
     */
    public static FieldSpec optionalFrom(String name, FieldType type, String otherField) {
        return new FieldSpec(name, type, false, null, otherField);
    }

    String defaultFor(Map<String, String> resolved) {
        return defaultFromField != null ? resolved.get(defaultFromField) : defaultValue;
    }
}
