package com.vaultwave.backend.download;

import com.vaultwave.backend.storage.StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Retires READY jobs past their retention window and fails jobs left behind by a crashed worker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DownloadSweepTask {

    static final String INTERRUPTED_REASON = "Packaging was interrupted, please request the download again.";

    private final GeneratedDownloadJobRepository jobRepository;
    private final StorageService storageService;
    private final TransactionTemplate transactionTemplate;

    @Value("${app.downloads.stuck-after-minutes:60}")
    private long stuckAfterMinutes;

    @Scheduled(fixedDelayString = "${app.downloads.sweep-interval-ms:600000}",
            initialDelayString = "${app.downloads.sweep-initial-delay-ms:60000}")
    public void run() {
        int expired = sweepExpired(Instant.now());
        int abandoned = failAbandoned(Instant.now().minus(Duration.ofMinutes(stuckAfterMinutes)));
        if (expired > 0 || abandoned > 0) {
            log.info("Download sweep: {} expired, {} abandoned", expired, abandoned);
        }
    }

    /**
     * READY → EXPIRED for every job whose expiry is at or before {@code now}. A job whose file
     * cannot be deleted stays READY and is retried on the next run.
     */
    public int sweepExpired(Instant now) {
        List<GeneratedDownloadJob> due = jobRepository.findAllByStatusAndExpiresAtLessThanEqual(DownloadJobStatus.READY, now);
        int count = 0;
        for (GeneratedDownloadJob job : due) {
            try {
                storageService.delete(job.getArtifactKey());
            } catch (IOException e) {
                log.warn("Could not delete artifact {} of job {}, will retry: {}", job.getArtifactKey(), job.getId(), e.getMessage());
                continue;
            }
            Boolean moved = transactionTemplate.execute(status -> expire(job.getId()));
            if (Boolean.TRUE.equals(moved)) count++;
        }
        return count;
    }

    /** Jobs still PENDING or PROCESSING with no progress since {@code cutoff} are failed. */
    public int failAbandoned(Instant cutoff) {
        List<GeneratedDownloadJob> stuck = jobRepository.findAllByStatusInAndUpdatedAtBefore(
                EnumSet.of(DownloadJobStatus.PENDING, DownloadJobStatus.PROCESSING), cutoff);
        int count = 0;
        for (GeneratedDownloadJob job : stuck) {
            Boolean moved = transactionTemplate.execute(status -> abandon(job.getId(), cutoff));
            if (Boolean.TRUE.equals(moved)) count++;
        }
        return count;
    }

    private boolean expire(Long jobId) {
        GeneratedDownloadJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.getStatus() != DownloadJobStatus.READY) return false;

        job.transitionTo(DownloadJobStatus.EXPIRED);
        job.setArtifactKey(null);
        job.setExpiresAt(null);
        job.setActiveKey(null);
        jobRepository.save(job);
        log.debug("Download job {} expired", jobId);
        return true;
    }

    private boolean abandon(Long jobId, Instant cutoff) {
        GeneratedDownloadJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.getStatus().isTerminal() || job.getUpdatedAt().isAfter(cutoff)) return false;

        log.warn("Download job {} abandoned in {} since {}", jobId, job.getStatus(), job.getUpdatedAt());
        job.transitionTo(DownloadJobStatus.FAILED);
        job.setFailureReason(INTERRUPTED_REASON);
        job.setActiveKey(null);
        jobRepository.save(job);
        return true;
    }
}
