package com.vaultwave.backend.exception;

/**
 * A payment event whose authenticity could not be established. No state is changed when this is raised.
 */
public class UntrustedEventException extends RuntimeException {

    public UntrustedEventException(String message) {
        super(message);
    }
}
