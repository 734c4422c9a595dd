package com.vaultwave.backend.download;

public record DownloadJobRequestedEvent(Long jobId) {
}
