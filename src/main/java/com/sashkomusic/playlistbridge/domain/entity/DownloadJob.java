package com.sashkomusic.playlistbridge.domain.entity;

import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.PendingOrganization;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "playlist_download_jobs", indexes = {
        @Index(name = "playlist_download_jobs_user_id_idx", columnList = "user_id"),
        @Index(name = "playlist_download_jobs_status_idx", columnList = "status")
})
@Getter
@Setter
public class DownloadJob {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "import_job_id")
    private String importJobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DownloadService service;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    private int totalItems;
    private int completedItems;
    private int failedItems;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "download_queue", columnDefinition = "jsonb")
    private List<DownloadQueueItem> downloadQueue = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "pending_organization", columnDefinition = "jsonb")
    private PendingOrganization pendingOrganization;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public DownloadJob() {
    }

    public DownloadJob(String userId, String importJobId, DownloadService service) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.importJobId = importJobId;
        this.service = service;
        this.createdAt = Instant.now();
    }

    public void recount() {
        this.totalItems = downloadQueue.size();
        this.completedItems = (int) downloadQueue.stream()
                .filter(item -> item.status() == DownloadItemStatus.COMPLETED)
                .count();
        this.failedItems = (int) downloadQueue.stream()
                .filter(item -> item.status() == DownloadItemStatus.FAILED)
                .count();
    }

    public boolean allItemsTerminal() {
        return downloadQueue.stream().allMatch(item -> item.status().isTerminal());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DownloadJob)) return false;
        DownloadJob other = (DownloadJob) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
