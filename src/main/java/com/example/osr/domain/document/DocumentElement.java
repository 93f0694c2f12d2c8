package com.example.osr.domain.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable node of an order document: element name, ordered attributes and ordered children.
 */
public final class DocumentElement {

    private final String name;
    private final Map<String, String> attributes;
    private final List<DocumentElement> children;

    private DocumentElement(String name, Map<String, String> attributes, List<DocumentElement> children) {
        this.name = Objects.requireNonNull(name, "Element name cannot be null");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = List.copyOf(children);
    }

    public static Builder element(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String attributeName) {
        return attributes.get(attributeName);
    }

    public List<DocumentElement> getChildren() {
        return children;
    }

    /**
     * Returns the first direct child with the given name, or null.
     */
    public DocumentElement child(String childName) {
        return children.stream()
                .filter(child -> child.name.equals(childName))
                .findFirst()
                .orElse(null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentElement that = (DocumentElement) o;
        return name.equals(that.name)
                && List.copyOf(attributes.entrySet()).equals(List.copyOf(that.attributes.entrySet()))
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, children);
    }

    @Override
    public String toString() {
        return "<" + name + " " + attributes + (children.isEmpty() ? "/>" : ">" + children + "</" + name + ">");
    }

    public static final class Builder {

        private final String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<DocumentElement> children = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder attribute(String attributeName, String value) {
            attributes.put(attributeName, Objects.requireNonNull(value, "Attribute value cannot be null: " + attributeName));
            return this;
        }

        public Builder child(DocumentElement child) {
            children.add(Objects.requireNonNull(child, "Child cannot be null"));
            return this;
        }

        public Builder child(Builder child) {
            return child(child.build());
        }

        public DocumentElement build() {
            return new DocumentElement(name, attributes, children);
        }
    }
}
