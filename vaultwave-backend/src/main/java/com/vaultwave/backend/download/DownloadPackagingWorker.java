package com.vaultwave.backend.download;

import com.vaultwave.backend.catalog.TrackRepository;
import com.vaultwave.backend.media.AudioTranscoder;
import com.vaultwave.backend.storage.StorageService;
import com.vaultwave.backend.util.AudioUtils;
import com.vaultwave.backend.util.ZipUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the archive for one download job. Runs on the packaging pool, never on a request
 * thread. Database work happens in short transactions around the file work so a long transcode
 * does not hold a connection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadPackagingWorker {

    static final String NO_TRACKS_REASON = "No tracks were found for packaging.";
    static final String QUEUE_FULL_REASON = "The packaging queue is full, please retry.";

    private final GeneratedDownloadJobRepository jobRepository;
    private final TrackRepository trackRepository;
    private final StorageService storageService;
    private final AudioTranscoder transcoder;
    private final TrackPlanner trackPlanner;
    private final TransactionTemplate transactionTemplate;

    @Value("${app.downloads.retention-hours:48}")
    private long retentionHours;

    private record Work(Long jobId, String releaseTitle, DownloadFormat format, List<TrackSource> tracks) {}

    public void execute(Long jobId) {
        Work work = transactionTemplate.execute(status -> start(jobId));
        if (work == null) {
            return;
        }

        Path tempDir = null;
        String storedKey = null;
        try {
            if (work.tracks().isEmpty()) {
                throw new PackagingException(NO_TRACKS_REASON);
            }

            tempDir = Files.createTempDirectory("vaultwave-job-" + jobId + "-");
            List<ZipUtils.ZipSource> entries = new ArrayList<>();
            int done = 0;
            for (TrackSource track : work.tracks()) {
                entries.add(prepareTrack(track, work.format(), tempDir));
                done++;
                // leave the last few percent for zipping and upload
                jobRepository.updateProgress(jobId, done * 90 / work.tracks().size(), Instant.now());
            }

            String archiveName = AudioUtils.sanitizeTitle(work.releaseTitle()).replace(' ', '_')
                    + "_" + work.format().name() + ".zip";
            Path archive = tempDir.resolve("job-" + jobId + ".zip");
            ZipUtils.writeZip(entries, archive);

            storedKey = "downloads/job-" + jobId + "/" + archiveName;
            try (InputStream in = Files.newInputStream(archive)) {
                storageService.store(storedKey, in);
            }

            String key = storedKey;
            transactionTemplate.executeWithoutResult(status -> markReady(jobId, key, archiveName));
            log.info("Download job {} is READY ({} track(s), key {})", jobId, entries.size(), storedKey);
        } catch (Exception e) {
            log.error("Download job {} failed: {}", jobId, e.getMessage(), e);
            deleteQuietly(storedKey);
            String reason = reasonFor(e);
            transactionTemplate.executeWithoutResult(status -> markFailed(jobId, reason));
        } finally {
            if (tempDir != null) {
                try {
                    FileSystemUtils.deleteRecursively(tempDir);
                } catch (IOException e) {
                    log.warn("Could not remove temp dir {}: {}", tempDir, e.getMessage());
                }
            }
        }
    }

    // PENDING -> PROCESSING, and snapshot what the file work needs
    private Work start(Long jobId) {
        GeneratedDownloadJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Download job {} no longer exists", jobId);
            return null;
        }
        if (job.getStatus() != DownloadJobStatus.PENDING) {
            log.info("Download job {} is {}, skipping duplicate dispatch", jobId, job.getStatus());
            return null;
        }

        job.transitionTo(DownloadJobStatus.PROCESSING);
        job.setProgressPercent(0);
        jobRepository.save(job);

        List<TrackSource> tracks = trackRepository.findByReleaseIdOrderByTrackNumberAscIdAsc(job.getRelease().getId())
                .stream()
                .filter(t -> t.getAudioFilePath() != null && !t.getAudioFilePath().isBlank())
                .map(TrackSource::from)
                .toList();
        log.info("Download job {} PROCESSING: release {} as {}, {} track(s)",
                jobId, job.getRelease().getId(), job.getFormat(), tracks.size());
        return new Work(jobId, job.getRelease().getTitle(), job.getFormat(), tracks);
    }

    private ZipUtils.ZipSource prepareTrack(TrackSource track, DownloadFormat format, Path tempDir) throws Exception {
        Path source = tempDir.resolve("src-" + track.id() + "." + extensionOrBin(track));
        try (InputStream in = storageService.open(track.storageKey())) {
            Files.copy(in, source, StandardCopyOption.REPLACE_EXISTING);
        }

        TrackPlan plan = trackPlanner.plan(track, format, source, AudioUtils::probeMp3Bitrate);
        if (plan.copiesOriginal()) {
            return new ZipUtils.ZipSource(source, plan.entryName());
        }

        Path target = tempDir.resolve("out-" + track.id() + "." + plan.codec().extension());
        log.debug("Transcoding track {} to {} {}", track.id(), plan.codec(), plan.bitrateKbps());
        transcoder.transcode(source, target, plan.codec(), plan.bitrateKbps());
        return new ZipUtils.ZipSource(target, plan.entryName());
    }

    private void markReady(Long jobId, String artifactKey, String artifactName) {
        GeneratedDownloadJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Download job " + jobId + " disappeared"));
        job.transitionTo(DownloadJobStatus.READY);
        job.setArtifactKey(artifactKey);
        job.setArtifactName(artifactName);
        job.setExpiresAt(Instant.now().plus(Duration.ofHours(retentionHours)));
        job.setProgressPercent(100);
        job.setFailureReason(null);
        jobRepository.save(job);
    }

    /**
     * Fails a job the packaging pool refused, releasing its active slot so the user can request it
     * again. Runs in its own transaction because the caller sits in an after-commit callback.
     */
    public void markRejected(Long jobId) {
        TransactionTemplate requiresNew = new TransactionTemplate(transactionTemplate.getTransactionManager());
        requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        requiresNew.executeWithoutResult(status -> markFailed(jobId, QUEUE_FULL_REASON));
    }

    private void markFailed(Long jobId, String reason) {
        jobRepository.findById(jobId).ifPresent(job -> {
            if (!job.getStatus().canTransitionTo(DownloadJobStatus.FAILED)) {
                log.warn("Download job {} is {}, not marking as failed", jobId, job.getStatus());
                return;
            }
            job.transitionTo(DownloadJobStatus.FAILED);
            job.setFailureReason(reason);
            job.setArtifactKey(null);
            job.setArtifactName(null);
            job.setExpiresAt(null);
            job.setActiveKey(null);
            jobRepository.save(job);
        });
    }

    private void deleteQuietly(String key) {
        if (key == null) return;
        try {
            storageService.delete(key);
        } catch (IOException e) {
            log.warn("Could not remove partial artifact {}: {}", key, e.getMessage());
        }
    }

    private static String reasonFor(Exception e) {
        if (e instanceof PackagingException) return e.getMessage();
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String reason = "Packaging failed: " + detail;
        return reason.length() > 1000 ? reason.substring(0, 1000) : reason;
    }

    private static String extensionOrBin(TrackSource track) {
        String ext = TrackPlanner.sourceExtension(track);
        return ext != null ? ext : "bin";
    }

    static class PackagingException extends Exception {
        PackagingException(String message) {
            super(message);
        }
    }
}
