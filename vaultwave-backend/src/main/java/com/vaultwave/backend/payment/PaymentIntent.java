package com.vaultwave.backend.payment;

import java.math.BigDecimal;

/**
 * The provider's view of a payment.
 */
public record PaymentIntent(
        String id,
        PaymentIntentStatus status,
        String approvalUrl,
        BigDecimal amount,
        String currency
) {
}
