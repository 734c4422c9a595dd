package com.vaultwave.backend.payment;

import com.vaultwave.backend.order.OrderStatus;

public record ReconcileResult(ReconcileOutcome outcome, Long orderId, OrderStatus orderStatus) {

    static ReconcileResult withoutOrder(ReconcileOutcome outcome) {
        return new ReconcileResult(outcome, null, null);
    }
}
