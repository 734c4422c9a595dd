package com.vaultwave.backend.exception;

/**
 * The download job has not produced an artifact (still queued, running, or failed).
 */
public class DownloadNotReadyException extends DownloadExpiredException {

    public DownloadNotReadyException(String message) {
        super(message);
    }
}
