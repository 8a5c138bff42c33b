package com.sashkomusic.playlistbridge.domain.entity;

import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.MatchStatus;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "playlist_import_jobs", indexes = {
        @Index(name = "playlist_import_jobs_user_id_idx", columnList = "user_id"),
        @Index(name = "playlist_import_jobs_status_idx", columnList = "status")
})
@Getter
@Setter
public class ImportJob {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlaylistFormat format;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_platform", nullable = false)
    private Platform targetPlatform;

    @Column(name = "original_filename")
    private String originalFilename;

    @Column(name = "playlist_name")
    private String playlistName;

    @Column(name = "playlist_description", columnDefinition = "TEXT")
    private String playlistDescription;

    @Column(name = "target_playlist_id")
    private String targetPlaylistId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    private int totalSongs;
    private int processedSongs;
    private int matchedSongs;
    private int unmatchedSongs;
    private int pendingReviewSongs;
    private int addedSongs;
    private int duplicateSongs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "match_results", columnDefinition = "jsonb")
    private List<SongMatchResult> matchResults = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private List<String> warnings = new ArrayList<>();

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public ImportJob() {
    }

    public ImportJob(String userId, PlaylistFormat format, Platform targetPlatform) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.format = format;
        this.targetPlatform = targetPlatform;
        this.createdAt = Instant.now();
    }

    /**
     * Recomputes the status counters from {@link #matchResults}. Entries that are still
     * {@code null} have not been processed yet.
     */
    public void recount() {
        int processed = 0;
        int matched = 0;
        int unmatched = 0;
        int pending = 0;
        for (SongMatchResult result : matchResults) {
            if (result == null) {
                continue;
            }
            processed++;
            if (result.status() == MatchStatus.MATCHED) {
                matched++;
            } else if (result.status() == MatchStatus.PENDING_REVIEW) {
                pending++;
            } else {
                unmatched++;
            }
        }
        this.processedSongs = processed;
        this.matchedSongs = matched;
        this.unmatchedSongs = unmatched;
        this.pendingReviewSongs = pending;
    }

    public boolean isMatchingFinished() {
        return processedSongs == totalSongs && matchResults.stream().allMatch(Objects::nonNull);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportJob)) return false;
        ImportJob other = (ImportJob) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
