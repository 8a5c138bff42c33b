package com.sashkomusic.playlistbridge.domain.service.importing;

import com.sashkomusic.playlistbridge.config.PlaylistTransferConfig;
import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.exception.JobNotFoundException;
import com.sashkomusic.playlistbridge.domain.model.CommitResult;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import com.sashkomusic.playlistbridge.domain.repository.ImportJobRepository;
import com.sashkomusic.playlistbridge.domain.service.matching.SongMatcher;
import com.sashkomusic.playlistbridge.messaging.producer.ImportJobResultProducer;
import com.sashkomusic.playlistbridge.messaging.producer.dto.ImportJobCompleteDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the matching pass of an import job in the background.
 * <p>
 * At most {@code playlist-transfer.matching.concurrency} songs are matched at once. Each result is
 * written back at its original position as soon as it arrives, so progress is visible while the
 * pass is running. Cancellation is checked before each song is started; results arriving after
 * cancellation are dropped.
 */
@Slf4j
@Component
public class ImportJobRunner {

    private final ImportJobRepository jobRepository;
    private final SongMatcher songMatcher;
    private final MatchCommitter committer;
    private final JobLockRegistry locks;
    private final ImportJobResultProducer resultProducer;
    private final Executor executor;
    private final int concurrency;

    public ImportJobRunner(ImportJobRepository jobRepository,
                           SongMatcher songMatcher,
                           MatchCommitter committer,
                           JobLockRegistry locks,
                           ImportJobResultProducer resultProducer,
                           @Qualifier("importJobExecutor") Executor executor,
                           PlaylistTransferConfig config) {
        this.jobRepository = jobRepository;
        this.songMatcher = songMatcher;
        this.committer = committer;
        this.locks = locks;
        this.resultProducer = resultProducer;
        this.executor = executor;
        this.concurrency = Math.max(1, config.getMatching().getConcurrency());
    }

    public void submit(String jobId, List<Song> songs, List<CatalogAdapter> adapters) {
        executor.execute(() -> run(jobId, songs, adapters));
    }

    void run(String jobId, List<Song> songs, List<CatalogAdapter> adapters) {
        log.info("Matching {} songs for importJobId={} with up to {} in flight", songs.size(), jobId, concurrency);

        Semaphore permits = new Semaphore(concurrency);
        AtomicBoolean broken = new AtomicBoolean();
        AtomicInteger unreachable = new AtomicInteger();
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();

        try {
            for (int i = 0; i < songs.size(); i++) {
                if (shouldStop(jobId, broken)) {
                    break;
                }
                permits.acquire();
                if (shouldStop(jobId, broken)) {
                    permits.release();
                    break;
                }
                int position = i;
                Song song = songs.get(i);
                inFlight.add(CompletableFuture.runAsync(() -> {
                    try {
                        matchOne(jobId, position, song, adapters, unreachable);
                    } catch (RuntimeException e) {
                        broken.set(true);
                        log.error("Failed to record match for song {} of importJobId={}: {}",
                                position + 1, jobId, e.getMessage(), e);
                    } finally {
                        permits.release();
                    }
                }, executor));
            }
            CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new)).join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Matching interrupted for importJobId={}, job stays at its recorded progress", jobId);
            return;
        }

        if (broken.get()) {
            log.error("Matching stopped early for importJobId={}, job stays at its recorded progress", jobId);
            return;
        }
        finishMatching(jobId, unreachable.get());
    }

    private boolean shouldStop(String jobId, AtomicBoolean broken) {
        if (locks.isCancelled(jobId)) {
            log.info("Cancellation requested, no further songs will be matched for importJobId={}", jobId);
            return true;
        }
        return broken.get();
    }

    private void matchOne(String jobId, int position, Song song, List<CatalogAdapter> adapters,
                          AtomicInteger unreachable) {
        SongMatcher.MatchAttempt attempt = songMatcher.attempt(song, adapters);
        SongMatchResult result = attempt.result();
        if (attempt.catalogsUnavailable()) {
            unreachable.incrementAndGet();
        }

        locks.runLocked(jobId, () -> {
            if (locks.isCancelled(jobId)) {
                log.debug("Discarding result for song {} of cancelled importJobId={}", position + 1, jobId);
                return;
            }
            ImportJob job = jobRepository.findById(jobId)
                    .orElseThrow(() -> new JobNotFoundException("Import job not found: " + jobId));
            if (job.getStatus() != JobStatus.PROCESSING) {
                log.debug("Discarding result for song {}, importJobId={} is {}", position + 1, jobId, job.getStatus());
                return;
            }

            List<SongMatchResult> results = new ArrayList<>(job.getMatchResults());
            results.set(position, result);
            job.setMatchResults(results);
            result.adapterErrors().forEach(error -> job.addWarning("Song " + (position + 1) + ": " + error));
            job.recount();
            jobRepository.save(job);

            log.debug("importJobId={} song {}/{} '{}' -> {}", jobId, job.getProcessedSongs(), job.getTotalSongs(),
                    song.displayName(), result.status());
        });
    }

    private void finishMatching(String jobId, int unreachableSongs) {
        locks.runLocked(jobId, () -> {
            ImportJob job = jobRepository.findById(jobId)
                    .orElseThrow(() -> new JobNotFoundException("Import job not found: " + jobId));
            if (job.getStatus() != JobStatus.PROCESSING) {
                log.info("Matching finished for importJobId={} which is already {}", jobId, job.getStatus());
                locks.release(jobId);
                return;
            }

            job.recount();
            if (job.getProcessedSongs() > 0 && unreachableSongs >= job.getProcessedSongs()) {
                job.setStatus(JobStatus.FAILED);
                job.setErrorMessage("Every catalog lookup failed: " + firstError(job));
                job.setCompletedAt(Instant.now());
                jobRepository.save(job);
                log.error("importJobId={} failed: {}", jobId, job.getErrorMessage());
                locks.release(jobId);
            } else if (job.getPendingReviewSongs() > 0) {
                jobRepository.save(job);
                log.info("importJobId={} awaiting review: {} matched, {} pending, {} unmatched", jobId,
                        job.getMatchedSongs(), job.getPendingReviewSongs(), job.getUnmatchedSongs());
            } else {
                complete(job);
                locks.release(jobId);
            }
            resultProducer.send(ImportJobCompleteDto.from(job));
        });
    }

    /**
     * Commits matched songs and completes the job. A commit failure leaves the job processing
     * so that finalizing it again retries the commit.
     */
    void complete(ImportJob job) {
        try {
            CommitResult commit = committer.commit(job);
            job.setAddedSongs(commit.added());
            job.setDuplicateSongs(commit.duplicates());
            job.setStatus(JobStatus.COMPLETED);
            job.setErrorMessage(null);
            job.setCompletedAt(Instant.now());
            jobRepository.save(job);
            log.info("importJobId={} completed: {} added, {} duplicates, {} unmatched", job.getId(),
                    commit.added(), commit.duplicates(), job.getUnmatchedSongs());
        } catch (RuntimeException e) {
            log.error("Commit failed for importJobId={}: {}", job.getId(), e.getMessage(), e);
            job.setErrorMessage("Commit failed: " + e.getMessage());
            jobRepository.save(job);
        }
    }

    private static String firstError(ImportJob job) {
        return job.getMatchResults().stream()
                .filter(Objects::nonNull)
                .flatMap(result -> result.adapterErrors().stream())
                .findFirst()
                .orElse("unknown error");
    }
}
