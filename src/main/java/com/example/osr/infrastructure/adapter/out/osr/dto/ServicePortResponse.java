package com.example.osr.infrastructure.adapter.out.osr.dto;

/**
 * Naming service reply locating the OSR host interface.
 */
public record ServicePortResponse(String endpoint) {
}
