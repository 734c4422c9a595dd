package com.vaultwave.backend.download;

public enum DownloadJobStatus {
    PENDING,
    PROCESSING,
    READY,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == READY || this == FAILED || this == EXPIRED;
    }

    /** One-directional; READY only ever moves to EXPIRED. */
    public boolean canTransitionTo(DownloadJobStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == READY || next == FAILED;
            case READY -> next == EXPIRED;
            case FAILED, EXPIRED -> false;
        };
    }
}
