package com.vaultwave.backend.media;

public class TranscodeException extends Exception {
    public TranscodeException(String message) {
        super(message);
    }

    public TranscodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
