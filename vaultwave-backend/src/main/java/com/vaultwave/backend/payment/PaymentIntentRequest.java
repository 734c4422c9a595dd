package com.vaultwave.backend.payment;

import java.math.BigDecimal;

public record PaymentIntentRequest(
        Long orderId,
        BigDecimal amount,
        String currency,
        String description,
        String returnUrl
) {
}
