package com.vaultwave.backend.exception;

/**
 * Thrown when an operation is not allowed in the order's current status.
 */
public class OrderStateException extends RuntimeException {

    public OrderStateException(String message) {
        super(message);
    }
}
