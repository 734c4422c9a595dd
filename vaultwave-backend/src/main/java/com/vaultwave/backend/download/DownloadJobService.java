package com.vaultwave.backend.download;

import com.vaultwave.backend.catalog.PricingModel;
import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.catalog.ProductRepository;
import com.vaultwave.backend.catalog.Release;
import com.vaultwave.backend.catalog.ReleaseRepository;
import com.vaultwave.backend.exception.DownloadExpiredException;
import com.vaultwave.backend.exception.DownloadNotReadyException;
import com.vaultwave.backend.exception.NotEntitledException;
import com.vaultwave.backend.library.LibraryEntryRepository;
import com.vaultwave.backend.storage.StorageService;
import com.vaultwave.backend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadJobService {

    private final GeneratedDownloadJobRepository jobRepository;
    private final ReleaseRepository releaseRepository;
    private final ProductRepository productRepository;
    private final LibraryEntryRepository libraryEntryRepository;
    private final StorageService storageService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    /**
     * Return the live job for (user, release, format), or create one and queue it.
     *
     * @throws NotEntitledException when the user neither owns the release nor can get it free
     */
    public JobRequestResult request(User user, Long releaseId, DownloadFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("Download format is required");
        }
        try {
            return transactionTemplate.execute(status -> findOrCreate(user, releaseId, format));
        } catch (DataIntegrityViolationException e) {
            // A concurrent request inserted the same active key first; hand back its job
            String key = GeneratedDownloadJob.activeKeyFor(user.getId(), releaseId, format);
            log.info("Concurrent download request for {}, returning the existing job", key);
            return jobRepository.findByActiveKey(key)
                    .map(job -> new JobRequestResult(job, false))
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public GeneratedDownloadJob status(User user, Long jobId) {
        return ownedJob(user, jobId);
    }

    @Transactional(readOnly = true)
    public List<GeneratedDownloadJob> list(User user) {
        return jobRepository.findAllByUserIdOrderByCreatedAtDesc(user.getId());
    }

    /**
     * @throws DownloadExpiredException once the retention window has passed, even if the file still exists
     * @throws DownloadNotReadyException while the job is queued or running, or after it failed
     */
    @Transactional(readOnly = true)
    public DownloadArtifact fetchArtifact(User user, Long jobId) {
        GeneratedDownloadJob job = ownedJob(user, jobId);
        Instant now = Instant.now();

        if (job.getStatus() == DownloadJobStatus.EXPIRED
                || (job.getStatus() == DownloadJobStatus.READY && !job.isFetchable(now))) {
            throw new DownloadExpiredException("This download has expired, please request it again");
        }
        if (job.getStatus() != DownloadJobStatus.READY) {
            throw new DownloadNotReadyException("Download job " + jobId + " is " + job.getStatus());
        }

        try {
            return new DownloadArtifact(storageService.load(job.getArtifactKey()), job.getArtifactName());
        } catch (IOException e) {
            log.error("Artifact {} for READY job {} is missing from storage", job.getArtifactKey(), jobId, e);
            throw new DownloadExpiredException("This download is no longer available, please request it again");
        }
    }

    private JobRequestResult findOrCreate(User user, Long releaseId, DownloadFormat format) {
        Release release = releaseRepository.findById(releaseId)
                .filter(Release::isPublished)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Release not found"));
        ensureEntitled(user, release);

        String key = GeneratedDownloadJob.activeKeyFor(user.getId(), releaseId, format);
        GeneratedDownloadJob existing = jobRepository.findByActiveKey(key).orElse(null);
        if (existing != null) {
            if (existing.getStatus() == DownloadJobStatus.READY && !existing.isFetchable(Instant.now())) {
                // Past retention but not swept yet; release the key so a fresh job can take it
                existing.setActiveKey(null);
                jobRepository.saveAndFlush(existing);
            } else {
                log.debug("Returning live download job {} for {}", existing.getId(), key);
                return new JobRequestResult(existing, false);
            }
        }

        GeneratedDownloadJob job = new GeneratedDownloadJob();
        job.setUser(user);
        job.setRelease(release);
        job.setFormat(format);
        job.setStatus(DownloadJobStatus.PENDING);
        job.setActiveKey(key);
        GeneratedDownloadJob saved = jobRepository.saveAndFlush(job);

        eventPublisher.publishEvent(new DownloadJobRequestedEvent(saved.getId()));
        log.info("Queued download job {} for user {}: release {} as {}", saved.getId(), user.getId(), releaseId, format);
        return new JobRequestResult(saved, true);
    }

    private void ensureEntitled(User user, Release release) {
        Product product = productRepository.findByReleaseId(release.getId()).orElse(null);
        if (product != null && libraryEntryRepository.existsByUserIdAndProductId(user.getId(), product.getId())) {
            return;
        }
        if (product != null && product.isActive() && product.getPricingModel() == PricingModel.FREE) {
            return;
        }
        throw new NotEntitledException("You do not own '" + release.getTitle() + "'");
    }

    private GeneratedDownloadJob ownedJob(User user, Long jobId) {
        GeneratedDownloadJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Download job not found"));
        if (!job.getUser().getId().equals(user.getId())) {
            throw new SecurityException("Download job " + jobId + " belongs to another user");
        }
        return job;
    }
}
