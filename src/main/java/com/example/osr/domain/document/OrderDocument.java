package com.example.osr.domain.document;

import com.example.osr.domain.model.OrderKind;

import java.util.Objects;

/**
 * Canonical, schema-validated representation of an order, as the OSR host interface expects it.
 * Only a FINALIZED document is eligible for transmission.
 */
public final class OrderDocument {

    public static final String ROOT_ELEMENT = "host2osr";

    private final OrderKind kind;
    private final String orderNumber;
    private final DocumentElement root;
    private final DocumentState state;

    OrderDocument(OrderKind kind, String orderNumber, DocumentElement root, DocumentState state) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.orderNumber = Objects.requireNonNull(orderNumber, "OrderNumber cannot be null");
        this.root = Objects.requireNonNull(root, "Root element cannot be null");
        this.state = Objects.requireNonNull(state, "State cannot be null");
        if (!ROOT_ELEMENT.equals(root.getName())) {
            throw new IllegalArgumentException("Document root must be <" + ROOT_ELEMENT + ">, got <" + root.getName() + ">");
        }
    }

    /**
     * Returns a finalized copy of this document. Finalizing a finalized document returns it unchanged.
     *
     * @return the finalized document
     */
    public OrderDocument finalizeDocument() {
        if (state == DocumentState.FINALIZED) {
            return this;
        }
        return new OrderDocument(kind, orderNumber, root, DocumentState.FINALIZED);
    }

    public boolean isFinalized() {
        return state == DocumentState.FINALIZED;
    }

    /**
     * Renders the document as host2osr XML. Element and attribute order follow the schema.
     *
     * @return the XML text without declaration
     */
    public String toXml() {
        return DocumentXmlWriter.write(root);
    }

    public OrderKind getKind() {
        return kind;
    }

    /**
     * The order number the OSR knows this order by, e.g. {@code src-pick-42}.
     */
    public String getOrderNumber() {
        return orderNumber;
    }

    public DocumentElement getRoot() {
        return root;
    }

    /**
     * The order element directly below the root.
     */
    public DocumentElement getOrderElement() {
        return root.getChildren().get(0);
    }

    public DocumentState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderDocument that = (OrderDocument) o;
        return kind == that.kind && state == that.state
                && orderNumber.equals(that.orderNumber) && root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, orderNumber, root, state);
    }

    @Override
    public String toString() {
        return "OrderDocument{" +
                "kind=" + kind +
                ", orderNumber=" + orderNumber +
                ", state=" + state +
                '}';
    }
}
