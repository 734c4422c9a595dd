package com.vaultwave.backend.payment;

public enum GatewayEventType {
    CAPTURED,
    VOIDED,
    // anything we acknowledge but do not act on (approval pending, refunds, disputes)
    IGNORED;

    static GatewayEventType fromProviderEvent(String eventType) {
        if (eventType == null) return IGNORED;
        return switch (eventType) {
            case "PAYMENT.CAPTURE.COMPLETED" -> CAPTURED;
            case "PAYMENT.CAPTURE.DENIED", "PAYMENT.CAPTURE.VOIDED" -> VOIDED;
            default -> IGNORED;
        };
    }

    static GatewayEventType fromIntentStatus(PaymentIntentStatus status) {
        return switch (status) {
            case CAPTURED -> CAPTURED;
            case DENIED, VOIDED -> VOIDED;
            case CREATED -> IGNORED;
        };
    }
}
