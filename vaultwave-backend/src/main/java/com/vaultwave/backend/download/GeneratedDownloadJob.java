package com.vaultwave.backend.download;

import com.vaultwave.backend.catalog.Release;
import com.vaultwave.backend.user.User;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One packaging request for (user, release, format).
 *
 * <p>{@code activeKey} is set while the job is live (queued, running, or READY within its
 * retention window) and cleared when it leaves that set. Its unique constraint is what keeps a
 * double-click from starting two jobs.
 */
@Entity
@Data
@NoArgsConstructor
@ToString(exclude = {"user", "release"})
@EqualsAndHashCode(exclude = {"user", "release"})
@Table(name = "download_jobs",
        indexes = @Index(name = "ix_download_jobs_status_expires", columnList = "status, expiresAt"))
public class GeneratedDownloadJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "release_id")
    private Release release;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DownloadFormat format;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DownloadJobStatus status = DownloadJobStatus.PENDING;

    @Column(unique = true, length = 100)
    private String activeKey;

    private String artifactKey;
    private String artifactName;

    @Column(length = 1000)
    private String failureReason;

    private int progressPercent;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;

    public static String activeKeyFor(Long userId, Long releaseId, DownloadFormat format) {
        return userId + ":" + releaseId + ":" + format.name();
    }

    public void transitionTo(DownloadJobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Download job " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    public boolean isFetchable(Instant now) {
        return status == DownloadJobStatus.READY && expiresAt != null && now.isBefore(expiresAt);
    }

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
