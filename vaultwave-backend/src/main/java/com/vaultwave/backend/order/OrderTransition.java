package com.vaultwave.backend.order;

/**
 * Result of a ledger mutation. {@code applied} is false when the call was an idempotent no-op
 * and the order was returned as it already stood.
 */
public record OrderTransition(Order order, boolean applied) {
}
