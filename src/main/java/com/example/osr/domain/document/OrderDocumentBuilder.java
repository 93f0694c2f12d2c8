package com.example.osr.domain.document;

import com.example.osr.domain.exception.OrderValidationException;
import com.example.osr.domain.model.OrderKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.example.osr.domain.document.DocumentElement.element;
import static com.example.osr.domain.document.OrderSchema.COMPARTMENT_TYPE;
import static com.example.osr.domain.document.OrderSchema.ITEM;
import static com.example.osr.domain.document.OrderSchema.LOCATION;
import static com.example.osr.domain.document.OrderSchema.ORDER_NUMBER;
import static com.example.osr.domain.document.OrderSchema.PRODUCT_NAME;
import static com.example.osr.domain.document.OrderSchema.QUANTITY;

/**
 * Turns an {@link OrderSpec} into a validated DRAFT {@link OrderDocument}.
 * Fields are validated in declared schema order, header first, then each line;
 * the first invalid field aborts the build. Never touches network or disk.
 */
public class OrderDocumentBuilder {

    private static final String LINES = "lines";

    private final DocumentSettings settings;

    public OrderDocumentBuilder(DocumentSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
    }

    /**
     * Builds the document for the given spec.
     *
     * @param spec the operator input
     * @return a DRAFT document
     * @throws OrderValidationException for the first invalid, missing or unknown field
     */
    public OrderDocument build(OrderSpec spec) {
        Objects.requireNonNull(spec, "OrderSpec cannot be null");
        OrderKind kind = spec.getKind();
        OrderSchema schema = OrderSchema.forKind(kind);

        boolean implicitLine = kind.isMultiLine() && spec.getLines().isEmpty();
        Map<String, String> header = resolve(schema.headerFields(), spec.getFields(), "");
        List<Map<String, String>> lines = resolveLines(schema, spec, implicitLine);

        rejectUnknownHeaderFields(schema, spec, implicitLine);

        String orderNumber = settings.orderPrefix() + "-" + kind.getOrderNumberTag() + "-" + header.get(ORDER_NUMBER);
        DocumentElement orderElement = switch (kind) {
            case STANDARD -> standardPick(orderNumber, header, lines);
            case MANUAL -> manualPick(orderNumber, lines);
            case INVENTORY -> inventory(orderNumber, header);
            case GOODS_IN -> goodsIn(orderNumber, header);
            case GOODS_ADD -> goodsAdd(orderNumber, header);
        };

        DocumentElement root = element(OrderDocument.ROOT_ELEMENT).child(orderElement).build();
        return new OrderDocument(kind, orderNumber, root, DocumentState.DRAFT);
    }

    private List<Map<String, String>> resolveLines(OrderSchema schema, OrderSpec spec, boolean implicitLine) {
        if (!spec.getKind().isMultiLine()) {
            if (!spec.getLines().isEmpty()) {
                throw new OrderValidationException(LINES, "order kind " + spec.getKind() + " does not take order lines");
            }
            return List.of();
        }
        if (implicitLine) {
            return List.of(resolve(schema.lineFields(), spec.getFields(), ""));
        }

        Set<String> allowed = names(schema.lineFields());
        List<Map<String, String>> resolved = new ArrayList<>();
        for (int i = 0; i < spec.getLines().size(); i++) {
            Map<String, String> line = spec.getLines().get(i);
            String prefix = LINES + "[" + i + "].";
            resolved.add(resolve(schema.lineFields(), line, prefix));
            for (String name : line.keySet()) {
                if (!allowed.contains(name)) {
                    throw new OrderValidationException(prefix + name, "unknown field for order kind " + spec.getKind());
                }
            }
        }
        return resolved;
    }

    private Map<String, String> resolve(List<FieldSpec> fields, Map<String, String> raw, String prefix) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            String value = raw.get(field.name());
            if (value == null || value.isBlank()) {
                if (field.required()) {
                    throw new OrderValidationException(prefix + field.name(), "is required");
                }
                value = field.defaultFor(resolved);
            } else {
                value = value.strip();
            }
            field.type().check(value).ifPresent(reason -> {
                throw new OrderValidationException(prefix + field.name(), reason);
            });
            resolved.put(field.name(), value);
        }
        return resolved;
    }

    private void rejectUnknownHeaderFields(OrderSchema schema, OrderSpec spec, boolean implicitLine) {
        Set<String> allowed = names(schema.headerFields());
        if (implicitLine) {
            allowed.addAll(names(schema.lineFields()));
        }
        for (String name : spec.getFields().keySet()) {
            if (!allowed.contains(name)) {
                throw new OrderValidationException(name, "unknown field for order kind " + spec.getKind());
            }
        }
    }

    private static Set<String> names(List<FieldSpec> fields) {
        Set<String> names = new HashSet<>();
        fields.forEach(field -> names.add(field.name()));
        return names;
    }

    private DocumentElement standardPick(String orderNumber, Map<String, String> header, List<Map<String, String>> lines) {
        DocumentElement.Builder order = element("pick_order")
                .attribute("order_number", orderNumber)
                .attribute("container_number", header.get(LOCATION))
                .attribute("processing_mode", "standard");
        for (Map<String, String> line : lines) {
            order.child(element("pick_order_line")
                    .attribute("quantity", line.get(QUANTITY))
                    .attribute("target_slot", "1")
                    .child(element("product")
                            .attribute("product_code", line.get(ITEM))
                            .attribute("name", line.get(PRODUCT_NAME))
                            .attribute("returned", "false")));
        }
        return order.build();
    }

    private DocumentElement manualPick(String orderNumber, List<Map<String, String>> lines) {
        DocumentElement.Builder order = element("pick_order")
                .attribute("order_number", orderNumber)
                .attribute("processing_mode", "manual");
        for (Map<String, String> line : lines) {
            order.child(element("pick_order_line")
                    .attribute("quantity", line.get(QUANTITY))
                    .child(element("product")
                            .attribute("product_code", line.get(ITEM))
                            .attribute("name", line.get(PRODUCT_NAME))));
        }
        return order.build();
    }

    private DocumentElement inventory(String orderNumber, Map<String, String> header) {
        return element("inventory_order")
                .attribute("order_number", orderNumber)
                .attribute("processing_mode", "standard")
                .attribute("container_number", header.get(LOCATION))
                .child(element("product")
                        .attribute("product_code", header.get(ITEM)))
                .build();
    }

    private DocumentElement goodsIn(String orderNumber, Map<String, String> header) {
        return element("goods_in_order")
                .attribute("order_number", orderNumber)
                .attribute("compartment_number", header.get(LOCATION))
                .attribute("compartment_type", header.get(COMPARTMENT_TYPE))
                .attribute("processing_mode", "standard")
                .child(goodsInLine(header))
                .build();
    }

    private DocumentElement goodsAdd(String orderNumber, Map<String, String> header) {
        return element("goods_in_order")
                .attribute("order_number", orderNumber)
                .attribute("processing_mode", "renewal")
                .child(goodsInLine(header))
                .build();
    }

    private DocumentElement goodsInLine(Map<String, String> header) {
        DocumentElement.Builder product = element("product")
                .attribute("product_code", header.get(ITEM))
                .attribute("name", header.get(PRODUCT_NAME))
                .attribute("returned", "false")
                .attribute("bundle_size", "1");
        settings.capacitySpecs().forEach((compartmentType, maximum) ->
                product.child(element("capacity_spec")
                        .attribute("compartment_type", compartmentType)
                        .attribute("maximum_quantity", String.valueOf(maximum))));
        return element("goods_in_order_line")
                .attribute("quantity_advertised", header.get(QUANTITY))
                .child(product)
                .build();
    }
}
