package com.example.osr.infrastructure.adapter.in.web.dto;

public record PurgeResponse(int removed) {}
