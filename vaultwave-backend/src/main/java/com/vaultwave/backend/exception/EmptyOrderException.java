package com.vaultwave.backend.exception;

/**
 * Thrown when an order is requested with no line items.
 */
public class EmptyOrderException extends RuntimeException {

    public EmptyOrderException(String message) {
        super(message);
    }
}
