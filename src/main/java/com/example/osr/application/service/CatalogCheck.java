package com.example.osr.application.service;

import com.example.osr.application.port.out.CatalogLookupPort;
import com.example.osr.domain.document.OrderSchema;
import com.example.osr.domain.document.OrderSpec;
import com.example.osr.domain.exception.OrderValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rejects product codes the catalog does not know. Does nothing when no catalog is configured.
 * Runs on specs the document builder has already accepted, so every item code is present and well formed.
 */
@Component
public class CatalogCheck {

    private static final Logger log = LoggerFactory.getLogger(CatalogCheck.class);

    private final Optional<CatalogLookupPort> catalog;

    public CatalogCheck(Optional<CatalogLookupPort> catalog) {
        this.catalog = catalog;
    }

    /**
     * @throws OrderValidationException naming the first item field whose code is not in the catalog
     */
    public void verify(OrderSpec spec) {
        if (catalog.isEmpty()) {
            return;
        }
        CatalogLookupPort lookup = catalog.get();
        verifyItem(lookup, spec.getFields(), OrderSchema.ITEM);
        List<Map<String, String>> lines = spec.getLines();
        for (int i = 0; i < lines.size(); i++) {
            verifyItem(lookup, lines.get(i), "lines[" + i + "]." + OrderSchema.ITEM);
        }
    }

    private static void verifyItem(CatalogLookupPort lookup, Map<String, String> fields, String fieldName) {
        String code = fields.get(OrderSchema.ITEM);
        // kinds without an item in this position
        if (code == null || code.isBlank()) {
            return;
        }
        String stripped = code.strip();
        if (lookup.lookup(stripped).isEmpty()) {
            log.debug("Product code {} not in catalog", stripped);
            throw new OrderValidationException(fieldName, "unknown product code " + stripped);
        }
    }
}
