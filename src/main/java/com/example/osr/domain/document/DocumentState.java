package com.example.osr.domain.document;

/**
 * Editing state of an order document.
 */
public enum DocumentState {
    DRAFT,      // Built and valid, not yet released for transmission
    FINALIZED   // Immutable, eligible for transmission
}
