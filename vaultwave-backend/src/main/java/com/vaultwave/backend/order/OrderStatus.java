package com.vaultwave.backend.order;

/**
 * PENDING → COMPLETED | FAILED | CANCELLED. Nothing leaves a terminal status.
 */
public enum OrderStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return this == PENDING && next != PENDING;
    }
}
