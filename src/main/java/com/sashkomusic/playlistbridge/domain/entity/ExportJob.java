package com.sashkomusic.playlistbridge.domain.entity;

import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "playlist_export_jobs", indexes = {
        @Index(name = "playlist_export_jobs_user_id_idx", columnList = "user_id")
})
@Getter
@Setter
public class ExportJob {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "playlist_id")
    private String playlistId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlaylistFormat format;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_platform", nullable = false)
    private Platform sourcePlatform = Platform.NAVIDROME;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    private int totalSongs;
    private int processedSongs;
    private int enrichedSongs;

    @Column(name = "exported_data", columnDefinition = "TEXT")
    private String exportedData;

    @Column
    private String filename;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public ExportJob() {
    }

    public ExportJob(String userId, String playlistId, PlaylistFormat format) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.playlistId = playlistId;
        this.format = format;
        this.createdAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExportJob)) return false;
        ExportJob other = (ExportJob) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
