package com.vaultwave.backend.exception;

/**
 * The job has no artifact that can be fetched right now. Thrown as-is once the retention window
 * has passed; the client should request a new download.
 */
public class DownloadExpiredException extends RuntimeException {

    public DownloadExpiredException(String message) {
        super(message);
    }
}
