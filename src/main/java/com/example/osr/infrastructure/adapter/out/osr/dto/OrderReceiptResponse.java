package com.example.osr.infrastructure.adapter.out.osr.dto;

public record OrderReceiptResponse(String reference) {
}
