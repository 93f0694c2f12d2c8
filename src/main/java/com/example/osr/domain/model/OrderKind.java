package com.example.osr.domain.model;

/**
 * The closed set of order kinds the OSR host interface accepts.
 */
public enum OrderKind {

    /**
     * Pick order against a known container, processed automatically.
     */
    STANDARD("pick", true),

    /**
     * Pick order processed manually at a workstation, no container given.
     */
    MANUAL("pick-manual", true),

    /**
     * Inventory (stock count) order for a single product in a container.
     */
    INVENTORY("inv", false),

    /**
     * Goods-in order booking new stock into a compartment.
     */
    GOODS_IN("goods-in", false),

    /**
     * Goods-in order in renewal mode, topping up existing stock.
     */
    GOODS_ADD("goods-add", false);

    private final String orderNumberTag;
    private final boolean multiLine;

    OrderKind(String orderNumberTag, boolean multiLine) {
        this.orderNumberTag = orderNumberTag;
        this.multiLine = multiLine;
    }

    /**
     * Tag embedded in the remote order number, e.g. {@code src-pick-1}.
     */
    public String getOrderNumberTag() {
        return orderNumberTag;
    }

    /**
     * Whether the kind carries a list of order lines.
     */
    public boolean isMultiLine() {
        return multiLine;
    }
}
