package com.example.osr.domain.document;

import com.example.osr.domain.model.OrderKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operator-supplied intent for one order: kind, raw field values and the dry-run flag.
 * Immutable once built. Field insertion order is kept but has no influence on the document.
 */
public final class OrderSpec {

    private final OrderKind kind;
    private final Map<String, String> fields;
    private final List<Map<String, String>> lines;
    private final boolean dryRun;

    private OrderSpec(OrderKind kind, Map<String, String> fields, List<Map<String, String>> lines, boolean dryRun) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        List<Map<String, String>> copiedLines = new ArrayList<>(lines.size());
        for (Map<String, String> line : lines) {
            copiedLines.add(Collections.unmodifiableMap(new LinkedHashMap<>(line)));
        }
        this.lines = Collections.unmodifiableList(copiedLines);
        this.dryRun = dryRun;
    }

    public static Builder builder(OrderKind kind) {
        return new Builder(kind);
    }

    public OrderKind getKind() {
        return kind;
    }

    /**
     * Header field values. For multi-line kinds without explicit lines these also hold the single line.
     */
    public Map<String, String> getFields() {
        return fields;
    }

    public List<Map<String, String>> getLines() {
        return lines;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    @Override
    public String toString() {
        return "OrderSpec{" +
                "kind=" + kind +
                ", fields=" + fields +
                ", lineCount=" + lines.size() +
                ", dryRun=" + dryRun +
                '}';
    }

    public static final class Builder {

        private final OrderKind kind;
        private final Map<String, String> fields = new LinkedHashMap<>();
        private final List<Map<String, String>> lines = new ArrayList<>();
        private boolean dryRun;

        private Builder(OrderKind kind) {
            this.kind = kind;
        }

        public Builder field(String name, String value) {
            fields.put(Objects.requireNonNull(name, "Field name cannot be null"), value);
            return this;
        }

        public Builder fields(Map<String, String> values) {
            values.forEach(this::field);
            return this;
        }

        public Builder line(Map<String, String> line) {
            lines.add(Objects.requireNonNull(line, "Line cannot be null"));
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public OrderSpec build() {
            return new OrderSpec(kind, fields, lines, dryRun);
        }
    }
}
