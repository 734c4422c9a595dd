package com.vaultwave.backend.exception;

/**
 * The payment provider could not be reached or answered with an error. Order status is never
 * changed when this is raised, so the user may simply retry.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
