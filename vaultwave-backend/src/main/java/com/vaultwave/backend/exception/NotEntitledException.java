package com.vaultwave.backend.exception;

/**
 * Thrown when a user asks for content they have not acquired.
 */
public class NotEntitledException extends RuntimeException {

    public NotEntitledException(String message) {
        super(message);
    }
}
