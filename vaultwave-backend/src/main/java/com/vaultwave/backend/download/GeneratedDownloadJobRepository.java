package com.vaultwave.backend.download;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface GeneratedDownloadJobRepository extends JpaRepository<GeneratedDownloadJob, Long> {

    Optional<GeneratedDownloadJob> findByActiveKey(String activeKey);

    List<GeneratedDownloadJob> findAllByUserIdOrderByCreatedAtDesc(Long userId);

    List<GeneratedDownloadJob> findAllByStatusAndExpiresAtLessThanEqual(DownloadJobStatus status, Instant cutoff);

    List<GeneratedDownloadJob> findAllByStatusInAndUpdatedAtBefore(Collection<DownloadJobStatus> statuses, Instant cutoff);

    @Transactional
    @Modifying
    @Query("UPDATE GeneratedDownloadJob j SET j.progressPercent = :progress, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.vaultwave.backend.download.DownloadJobStatus.PROCESSING")
    int updateProgress(@Param("id") Long id, @Param("progress") int progress, @Param("now") Instant now);
}
