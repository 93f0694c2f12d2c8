package com.example.osr.domain.document;

import com.example.osr.domain.model.OrderKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.example.osr.domain.document.FieldSpec.optional;
import static com.example.osr.domain.document.FieldSpec.optionalFrom;
import static com.example.osr.domain.document.FieldSpec.required;

/**
 * Field schema per order kind. Declared order is both validation order and output order.
 */
public record OrderSchema(
        OrderKind kind,
        List<FieldSpec> headerFields,
        List<FieldSpec> lineFields
) {

    public static final String ORDER_NUMBER = "orderNumber";
    public static final String LOCATION = "location";
    public static final String COMPARTMENT_TYPE = "compartmentType";
    public static final String QUANTITY = "qty";
    public static final String ITEM = "item";
    public static final String PRODUCT_NAME = "productName";

    private static final Map<OrderKind, OrderSchema> SCHEMAS = new EnumMap<>(OrderKind.class);

    static {
        FieldSpec orderNumber = optional(ORDER_NUMBER, FieldType.ORDER_NUMBER, "1");
        FieldSpec location = required(LOCATION, FieldType.LOCATION_CODE);
        FieldSpec quantity = required(QUANTITY, FieldType.QUANTITY);
        FieldSpec item = required(ITEM, FieldType.CATALOG_CODE);
        FieldSpec productName = optionalFrom(PRODUCT_NAME, FieldType.TEXT, ITEM);

        register(new OrderSchema(OrderKind.STANDARD,
                List.of(orderNumber, location),
                List.of(quantity, item, productName)));
        register(new OrderSchema(OrderKind.MANUAL,
                List.of(orderNumber),
                List.of(quantity, item, productName)));
        register(new OrderSchema(OrderKind.INVENTORY,
                List.of(orderNumber, location, item),
                List.of()));
        register(new OrderSchema(OrderKind.GOODS_IN,
                List.of(orderNumber, location,
                        optional(COMPARTMENT_TYPE, FieldType.COMPARTMENT_TYPE, "full"),
                        quantity, item, productName),
                List.of()));
        register(new OrderSchema(OrderKind.GOODS_ADD,
                List.of(orderNumber, quantity, item, productName),
                List.of()));
    }

    private static void register(OrderSchema schema) {
        SCHEMAS.put(schema.kind(), schema);
    }

    public static OrderSchema forKind(OrderKind kind) {
        return SCHEMAS.get(kind);
    }
}
