package com.vaultwave.backend.order.dto;

public record CancelOrderRequest(String reason) {
}
