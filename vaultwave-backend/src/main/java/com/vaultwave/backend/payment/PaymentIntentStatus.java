package com.vaultwave.backend.payment;

public enum PaymentIntentStatus {
    CREATED,
    CAPTURED,
    DENIED,
    VOIDED
}
