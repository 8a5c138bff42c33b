package com.sashkomusic.playlistbridge.domain.service.importing;

import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.entity.UserPlaylist;
import com.sashkomusic.playlistbridge.domain.exception.InvalidJobStateException;
import com.sashkomusic.playlistbridge.domain.exception.InvalidReviewException;
import com.sashkomusic.playlistbridge.domain.exception.JobNotFoundException;
import com.sashkomusic.playlistbridge.domain.model.ImportRequest;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.MatchReport;
import com.sashkomusic.playlistbridge.domain.model.MatchStatus;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.ReviewDecision;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import com.sashkomusic.playlistbridge.domain.model.ValidationResult;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import com.sashkomusic.playlistbridge.domain.repository.ImportJobRepository;
import com.sashkomusic.playlistbridge.domain.service.codec.MatchResultsCsvWriter;
import com.sashkomusic.playlistbridge.domain.service.codec.PlaylistCodec;
import com.sashkomusic.playlistbridge.domain.service.matching.MatchReportBuilder;
import com.sashkomusic.playlistbridge.domain.service.playlist.PlaylistStorageService;
import com.sashkomusic.playlistbridge.messaging.producer.ImportJobResultProducer;
import com.sashkomusic.playlistbridge.messaging.producer.dto.ImportJobCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImportJobService {

    private final PlaylistCodec codec;
    private final CatalogAdapterRegistry adapterRegistry;
    private final PlaylistStorageService playlistStorage;
    private final ImportJobRepository jobRepository;
    private final ImportJobRunner runner;
    private final JobLockRegistry locks;
    private final MatchReportBuilder reportBuilder;
    private final MatchResultsCsvWriter csvWriter;
    private final ImportJobResultProducer resultProducer;

    public ValidationResult validate(ImportRequest request) {
        return codec.validate(request.content(), request.format(), request.filename());
    }

    /**
     * Parses the playlist, creates the job in {@link JobStatus#PROCESSING} and starts matching
     * in the background. Input errors are thrown before any job exists.
     */
    public ImportJob startImport(ImportRequest request) {
        ParsedPlaylist parsed = codec.parse(request.content(), request.format(), request.filename());
        Platform targetPlatform = request.targetPlatformOrDefault();
        List<CatalogAdapter> adapters = adapterRegistry.adaptersFor(request.userId(), targetPlatform);
        UserPlaylist playlist = resolveTargetPlaylist(request, parsed);

        ImportJob job = new ImportJob(request.userId(), parsed.format(), targetPlatform);
        job.setOriginalFilename(request.filename());
        job.setPlaylistName(playlist.getName());
        job.setPlaylistDescription(parsed.playlist().description());
        job.setTargetPlaylistId(playlist.getId());
        job.setTotalSongs(parsed.playlist().songs().size());
        job.setMatchResults(new ArrayList<>(Collections.nCopies(job.getTotalSongs(), null)));
        job.setWarnings(new ArrayList<>(parsed.warnings()));
        job.setStatus(JobStatus.PROCESSING);
        job.setStartedAt(Instant.now());
        jobRepository.save(job);

        log.info("Started importJobId={} for user {}: {} songs from {} into playlist '{}'", job.getId(),
                request.userId(), job.getTotalSongs(), parsed.format(), playlist.getName());

        runner.submit(job.getId(), parsed.playlist().songs(), adapters);
        return job;
    }

    public ImportJob getImportJob(String userId, String jobId) {
        return jobRepository.findByIdAndUserId(jobId, userId)
                .orElseThrow(() -> new JobNotFoundException("Import job not found: " + jobId));
    }

    public MatchReport getMatchReport(String userId, String jobId) {
        return reportBuilder.build(getImportJob(userId, jobId).getMatchResults());
    }

    public String exportMatchResults(String userId, String jobId) {
        return csvWriter.write(getImportJob(userId, jobId).getMatchResults());
    }

    /**
     * Applies the reviewer's decisions and commits every matched song in original order.
     * Songs still pending without a decision are skipped. Calling this again on a finished
     * job returns it unchanged.
     */
    public ImportJob finalizeReview(String userId, String jobId, List<ReviewDecision> decisions) {
        getImportJob(userId, jobId);

        return locks.withLock(jobId, () -> {
            ImportJob job = getImportJob(userId, jobId);
            if (job.getStatus().isTerminal()) {
                log.info("importJobId={} is already {}, returning stored result", jobId, job.getStatus());
                return job;
            }
            if (job.getStatus() != JobStatus.PROCESSING || !job.isMatchingFinished()) {
                throw new InvalidJobStateException("Import job " + jobId + " is still matching songs ("
                        + job.getProcessedSongs() + "/" + job.getTotalSongs() + ")");
            }

            List<SongMatchResult> results = applyDecisions(job, decisions);
            job.setMatchResults(results);
            job.recount();

            runner.complete(job);
            if (job.getStatus() == JobStatus.COMPLETED) {
                locks.release(jobId);
            }
            resultProducer.send(ImportJobCompleteDto.from(job));
            return job;
        });
    }

    public ImportJob cancel(String userId, String jobId) {
        getImportJob(userId, jobId);

        return locks.withLock(jobId, () -> {
            ImportJob job = getImportJob(userId, jobId);
            if (job.getStatus().isTerminal()) {
                return job;
            }
            locks.requestCancel(jobId);
            job.recount();
            job.setStatus(JobStatus.CANCELLED);
            job.setCompletedAt(Instant.now());
            jobRepository.save(job);
            if (job.isMatchingFinished()) {
                locks.release(jobId);
            }

            log.info("Cancelled importJobId={} after {}/{} songs", jobId, job.getProcessedSongs(), job.getTotalSongs());
            resultProducer.send(ImportJobCompleteDto.from(job));
            return job;
        });
    }

    private List<SongMatchResult> applyDecisions(ImportJob job, List<ReviewDecision> decisions) {
        List<SongMatchResult> results = new ArrayList<>(job.getMatchResults());

        for (ReviewDecision decision : decisions != null ? decisions : List.<ReviewDecision>of()) {
            int position = decision.position();
            if (position < 0 || position >= results.size()) {
                throw new InvalidReviewException("No song at position " + position + " in import job " + job.getId());
            }
            SongMatchResult current = results.get(position);
            if (current.status() != MatchStatus.PENDING_REVIEW) {
                log.debug("Ignoring decision for song {} of importJobId={}, status is {}",
                        position + 1, job.getId(), current.status());
                continue;
            }
            results.set(position, decision.selection() != null ? current.select(decision.selection()) : current.skip());
        }

        for (int i = 0; i < results.size(); i++) {
            if (results.get(i).status() == MatchStatus.PENDING_REVIEW) {
                results.set(i, results.get(i).skip());
            }
        }
        return results;
    }

    private UserPlaylist resolveTargetPlaylist(ImportRequest request, ParsedPlaylist parsed) {
        if (request.targetPlaylistId() != null && !request.targetPlaylistId().isBlank()) {
            return playlistStorage.getPlaylist(request.userId(), request.targetPlaylistId());
        }
        String name = request.playlistName() != null && !request.playlistName().isBlank()
                ? request.playlistName().trim()
                : parsed.playlist().name();
        return playlistStorage.createPlaylist(request.userId(), name, parsed.playlist().description());
    }
}
