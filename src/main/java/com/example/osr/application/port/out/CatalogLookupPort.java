package com.example.osr.application.port.out;

import java.util.Optional;

/**
 * Output port for read-only product catalog lookups.
 */
public interface CatalogLookupPort {

    Optional<CatalogDescriptor> lookup(String code);

    record CatalogDescriptor(String code, String name) {
    }
}
