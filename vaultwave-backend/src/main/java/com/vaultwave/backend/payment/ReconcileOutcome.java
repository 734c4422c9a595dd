package com.vaultwave.backend.payment;

public enum ReconcileOutcome {
    COMPLETED,
    ALREADY_COMPLETED,
    FAILED,
    UNCHANGED,
    IGNORED,
    UNKNOWN_ORDER,
    // captured money for an order that can no longer complete; needs an operator
    REJECTED
}
