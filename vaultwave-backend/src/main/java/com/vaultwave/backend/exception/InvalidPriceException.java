package com.vaultwave.backend.exception;

/**
 * A charge amount could not be resolved for a product: missing, negative or below the minimum for name-your-price items.
 */
public class InvalidPriceException extends RuntimeException {

    public InvalidPriceException(String message) {
        super(message);
    }
}
