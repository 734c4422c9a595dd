package com.vaultwave.backend.download.dto;

import com.vaultwave.backend.download.DownloadJobStatus;
import com.vaultwave.backend.download.GeneratedDownloadJob;

import java.time.Instant;

public record DownloadJobDto(
        Long id,
        Long releaseId,
        String format,
        String status,
        int progressPercent,
        String failureReason,
        String artifactUrl,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt
) {
    public static DownloadJobDto from(GeneratedDownloadJob job) {
        boolean ready = job.getStatus() == DownloadJobStatus.READY;
        return new DownloadJobDto(
                job.getId(),
                job.getRelease().getId(),
                job.getFormat().name(),
                job.getStatus().name(),
                job.getProgressPercent(),
                job.getFailureReason(),
                ready ? "/api/download-jobs/" + job.getId() + "/artifact" : null,
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getExpiresAt()
        );
    }
}
