package com.vaultwave.backend.exception;

/**
 * Thrown when line items would settle in more than one currency. Such carts must be split into one order per currency.
 */
public class CurrencyMismatchException extends RuntimeException {

    public CurrencyMismatchException(String message) {
        super(message);
    }
}
