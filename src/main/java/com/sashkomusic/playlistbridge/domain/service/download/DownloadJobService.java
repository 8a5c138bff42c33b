package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.config.PlaylistTransferConfig;
import com.sashkomusic.playlistbridge.domain.entity.DownloadJob;
import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.exception.CatalogException;
import com.sashkomusic.playlistbridge.domain.exception.InvalidJobStateException;
import com.sashkomusic.playlistbridge.domain.exception.JobNotFoundException;
import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadReport;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import com.sashkomusic.playlistbridge.domain.model.MatchCandidate;
import com.sashkomusic.playlistbridge.domain.model.MatchStatus;
import com.sashkomusic.playlistbridge.domain.model.OrganizationFile;
import com.sashkomusic.playlistbridge.domain.model.PendingOrganization;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.model.SongMatchResult;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import com.sashkomusic.playlistbridge.domain.port.LibraryScanPort;
import com.sashkomusic.playlistbridge.domain.repository.DownloadJobRepository;
import com.sashkomusic.playlistbridge.domain.repository.ImportJobRepository;
import com.sashkomusic.playlistbridge.domain.service.importing.CatalogAdapterRegistry;
import com.sashkomusic.playlistbridge.domain.service.importing.JobLockRegistry;
import com.sashkomusic.playlistbridge.domain.service.matching.TextNormalizer;
import com.sashkomusic.playlistbridge.messaging.producer.DownloadJobResultProducer;
import com.sashkomusic.playlistbridge.messaging.producer.dto.DownloadJobCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadJobService {

    static final double LIBRARY_MATCH_THRESHOLD = 0.8;
    private static final int LIBRARY_SEARCH_LIMIT = 5;

    private final DownloadOrchestrator orchestrator;
    private final DownloadJobRepository jobRepository;
    private final ImportJobRepository importJobRepository;
    private final CatalogAdapterRegistry adapterRegistry;
    private final OrganizationPlanner organizationPlanner;
    private final PathMappingService pathMappingService;
    private final LibraryScanPort libraryScan;
    private final JobLockRegistry locks;
    private final PlaylistTransferConfig config;
    private final DownloadJobResultProducer resultProducer;

    public DownloadJob queueBatch(String userId, List<DownloadRequest> requests, DownloadPreferences preferences) {
        return createJob(userId, null, requests, preferencesOrDefault(preferences));
    }

    public DownloadJob queueSingle(String userId, DownloadRequest request, DownloadService service,
                                   DownloadPreferences preferences) {
        DownloadPreferences effective = preferencesOrDefault(preferences);
        DownloadJob job = newJob(userId, null, service != null ? service : effective.defaultService());
        job.setDownloadQueue(new ArrayList<>(List.of(orchestrator.queueSingle(request, service, effective))));
        return settle(job);
    }

    /**
     * Queues downloads for every song of a completed import that did not end up in the playlist.
     * A YouTube Music candidate, when one was found, pins the fetcher to that video.
     */
    public DownloadJob createFromImport(String userId, String importJobId, DownloadPreferences preferences) {
        ImportJob importJob = importJobRepository.findByIdAndUserId(importJobId, userId)
                .orElseThrow(() -> new JobNotFoundException("Import job not found: " + importJobId));
        if (importJob.getStatus() != JobStatus.COMPLETED) {
            throw new InvalidJobStateException("Import job " + importJobId + " is " + importJob.getStatus()
                    + ", downloads can only be queued for completed imports");
        }

        List<DownloadRequest> requests = new ArrayList<>();
        for (SongMatchResult result : importJob.getMatchResults()) {
            if (result == null || (result.status() != MatchStatus.NO_MATCH && result.status() != MatchStatus.SKIPPED)) {
                continue;
            }
            Song song = result.originalSong();
            requests.add(new DownloadRequest(song, videoIdFor(result), song.hasAlbum(), null, null));
        }
        log.info("Queueing {} missing song(s) from importJobId={}", requests.size(), importJobId);

        return createJob(userId, importJobId, requests, preferencesOrDefault(preferences));
    }

    public DownloadJob getJob(String userId, String jobId) {
        return jobRepository.findByIdAndUserId(jobId, userId)
                .orElseThrow(() -> new JobNotFoundException("Download job not found: " + jobId));
    }

    public DownloadReport getReport(String userId, String jobId) {
        return orchestrator.generateReport(getJob(userId, jobId).getDownloadQueue());
    }

    public DownloadQueueStatus getQueueStatus() {
        return orchestrator.getQueueStatus();
    }

    public Map<DownloadService, Boolean> availability() {
        return orchestrator.availability();
    }

    public DownloadJob cancelItem(String userId, String jobId, String itemId) {
        getJob(userId, jobId);
        return withJobLock(jobId, () -> {
            DownloadJob job = getJob(userId, jobId);
            DownloadQueueItem item = findItem(job, itemId);
            if (!orchestrator.cancel(item)) {
                return job;
            }
            replaceItem(job, item.toBuilder()
                    .status(DownloadItemStatus.FAILED)
                    .error("Cancelled")
                    .build());
            return settle(job);
        });
    }

    /**
     * Records that the given fetched files were moved into the library, or all of them when
     * {@code itemIds} is empty, and asks the media server to rescan.
     */
    public DownloadJob markOrganized(String userId, String jobId, Collection<String> itemIds) {
        getJob(userId, jobId);
        DownloadJob updated = withJobLock(jobId, () -> {
            DownloadJob job = getJob(userId, jobId);
            PendingOrganization pending = job.getPendingOrganization();
            if (pending == null) {
                return job;
            }
            Set<String> wanted = itemIds == null ? Set.of() : Set.copyOf(itemIds);

            List<DownloadQueueItem> queue = new ArrayList<>();
            for (DownloadQueueItem item : job.getDownloadQueue()) {
                boolean selected = wanted.isEmpty() || wanted.contains(item.id());
                queue.add(selected && item.needsManualOrganization()
                        ? item.toBuilder().needsManualOrganization(false).build()
                        : item);
            }
            List<OrganizationFile> files = pending.files().stream()
                    .map(file -> wanted.isEmpty() || wanted.contains(file.itemId()) ? file.markOrganized() : file)
                    .toList();

            job.setDownloadQueue(queue);
            job.setPendingOrganization(new PendingOrganization(files,
                    files.stream().allMatch(OrganizationFile::organized)));
            log.info("Marked {} file(s) organized for downloadJobId={}",
                    wanted.isEmpty() ? files.size() : wanted.size(), jobId);
            return jobRepository.save(job);
        });

        libraryScan.triggerScan(null);
        return updated;
    }

    public List<DownloadJob> activeJobs() {
        return jobRepository.findByStatus(JobStatus.PROCESSING);
    }

    /**
     * Pulls live state from the back-ends into the job's items and completes the job once
     * every item is terminal.
     */
    public DownloadJob refresh(String jobId) {
        return withJobLock(jobId, () -> {
            DownloadJob job = jobRepository.findById(jobId)
                    .orElseThrow(() -> new JobNotFoundException("Download job not found: " + jobId));
            if (job.getStatus().isTerminal()) {
                return job;
            }

            Map<DownloadService, Map<String, BackendQueueEntry>> live = liveEntries(job.getDownloadQueue());
            Set<String> claimed = new HashSet<>();
            job.getDownloadQueue().stream()
                    .map(DownloadQueueItem::serviceJobId)
                    .filter(Objects::nonNull)
                    .forEach(claimed::add);

            List<DownloadQueueItem> queue = new ArrayList<>();
            for (DownloadQueueItem item : job.getDownloadQueue()) {
                queue.add(merge(item, live.getOrDefault(item.service(), Map.of()), claimed));
            }
            job.setDownloadQueue(queue);
            return settle(job);
        });
    }

    /**
     * Runs the action under the job's lock and drops the lock once the job is finished.
     */
    private DownloadJob withJobLock(String jobId, Supplier<DownloadJob> action) {
        DownloadJob job = locks.withLock(jobId, action);
        if (job.getStatus().isTerminal()) {
            locks.release(jobId);
        }
        return job;
    }

    private DownloadJob createJob(String userId, String importJobId, List<DownloadRequest> requests,
                                  DownloadPreferences preferences) {
        DownloadJob job = newJob(userId, importJobId, preferences.defaultService());
        job.setDownloadQueue(new ArrayList<>(orchestrator.queueBatch(requests, preferences)));
        return settle(job);
    }

    private DownloadJob newJob(String userId, String importJobId, DownloadService service) {
        DownloadJob job = new DownloadJob(userId, importJobId, service);
        job.setStatus(JobStatus.PROCESSING);
        job.setStartedAt(Instant.now());
        return job;
    }

    private DownloadJob settle(DownloadJob job) {
        job.recount();
        job.setPendingOrganization(organizationPlanner.plan(job.getDownloadQueue(), job.getPendingOrganization()));

        boolean finished = job.allItemsTerminal();
        if (finished) {
            if (job.getTotalItems() > 0 && job.getFailedItems() == job.getTotalItems()) {
                job.setStatus(JobStatus.FAILED);
                job.setErrorMessage("All " + job.getTotalItems() + " downloads failed: " + firstError(job));
            } else {
                job.setStatus(JobStatus.COMPLETED);
            }
            job.setCompletedAt(Instant.now());
        }

        DownloadJob saved = jobRepository.save(job);
        log.info("downloadJobId={} status={} completed={}/{} failed={}", saved.getId(), saved.getStatus(),
                saved.getCompletedItems(), saved.getTotalItems(), saved.getFailedItems());
        if (finished) {
            resultProducer.send(DownloadJobCompleteDto.from(saved));
        }
        return saved;
    }

    private Map<DownloadService, Map<String, BackendQueueEntry>> liveEntries(List<DownloadQueueItem> queue) {
        Map<DownloadService, Map<String, BackendQueueEntry>> live = new EnumMap<>(DownloadService.class);
        queue.stream()
                .filter(item -> !item.status().isTerminal())
                .map(DownloadQueueItem::service)
                .distinct()
                .forEach(service -> {
                    try {
                        Map<String, BackendQueueEntry> byId = new LinkedHashMap<>();
                        for (BackendQueueEntry entry : orchestrator.backendEntries(service)) {
                            if (entry.serviceJobId() != null) {
                                byId.putIfAbsent(entry.serviceJobId(), entry);
                            }
                            if (entry.groupId() != null) {
                                byId.putIfAbsent(entry.groupId(), entry);
                            }
                        }
                        live.put(service, byId);
                    } catch (RuntimeException e) {
                        log.warn("Could not refresh {} state: {}", service.getValue(), e.getMessage());
                        log.debug("Refresh error details", e);
                    }
                });
        return live;
    }

    private DownloadQueueItem merge(DownloadQueueItem item, Map<String, BackendQueueEntry> entries, Set<String> claimed) {
        if (item.status().isTerminal() || item.serviceJobId() == null) {
            return item;
        }
        BackendQueueEntry entry = entries.get(item.serviceJobId());
        String serviceJobId = item.serviceJobId();
        if (entry == null && item.service() == DownloadService.SINGLE_TRACK_FETCHER
                && TrackFetcherDownloadHandler.isSearchSource(serviceJobId)) {
            entry = findSearchResult(item, entries.values(), claimed);
            if (entry != null) {
                claimed.add(entry.serviceJobId());
                serviceJobId = entry.serviceJobId();
                log.info("Item {} '{}' resolved to {}", item.id(), item.serviceJobId(), serviceJobId);
            }
        }
        if (entry == null) {
            return item;
        }

        String path = entry.path();
        if (path != null && item.service() == DownloadService.SINGLE_TRACK_FETCHER) {
            path = pathMappingService.mapFetcherPath(path);
        }
        DownloadQueueItem merged = item.toBuilder()
                .serviceJobId(serviceJobId)
                .status(entry.status())
                .progress(entry.progress())
                .error(entry.error())
                .downloadedPath(path != null ? path : item.downloadedPath())
                .build();

        if (merged.status() == DownloadItemStatus.COMPLETED) {
            merged = merged.toBuilder().availableInLibrary(isInLibrary(merged)).build();
        }
        return merged;
    }

    /**
     * Finds the back-end entry a search request turned into: an entry not yet tied to another item
     * whose title mentions both the song title and the artist.
     */
    private BackendQueueEntry findSearchResult(DownloadQueueItem item, Collection<BackendQueueEntry> entries,
                                               Set<String> claimed) {
        String title = TextNormalizer.normalizeTitle(item.title());
        if (title.isEmpty()) {
            return null;
        }
        String artist = Song.UNKNOWN_ARTIST.equals(item.artist()) ? "" : TextNormalizer.normalizeArtist(item.artist());
        return entries.stream()
                .distinct()
                .filter(entry -> entry.serviceJobId() != null && entry.title() != null)
                .filter(entry -> !claimed.contains(entry.serviceJobId()))
                .filter(entry -> {
                    String entryTitle = TextNormalizer.normalize(entry.title());
                    return entryTitle.contains(title) && entryTitle.contains(artist);
                })
                .findFirst()
                .orElse(null);
    }

    private Boolean isInLibrary(DownloadQueueItem item) {
        Optional<CatalogAdapter> catalog = adapterRegistry.localCatalog();
        if (catalog.isEmpty()) {
            return null;
        }
        try {
            String title = TextNormalizer.normalizeTitle(item.title());
            String artist = TextNormalizer.normalizeArtist(item.artist());
            return catalog.get().search(item.artist() + " " + item.title(), 0, LIBRARY_SEARCH_LIMIT).stream()
                    .anyMatch(hit -> TextNormalizer.similarity(title, TextNormalizer.normalizeTitle(hit.title())) >= LIBRARY_MATCH_THRESHOLD
                            && TextNormalizer.similarity(artist, TextNormalizer.normalizeArtist(hit.artist())) >= LIBRARY_MATCH_THRESHOLD);
        } catch (CatalogException e) {
            log.warn("Could not verify '{} - {}' in library: {}", item.artist(), item.title(), e.getMessage());
            return null;
        }
    }

    private DownloadQueueItem findItem(DownloadJob job, String itemId) {
        return job.getDownloadQueue().stream()
                .filter(item -> item.id().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new JobNotFoundException("Download item " + itemId + " not found in job " + job.getId()));
    }

    private void replaceItem(DownloadJob job, DownloadQueueItem replacement) {
        List<DownloadQueueItem> queue = new ArrayList<>(job.getDownloadQueue());
        queue.replaceAll(item -> item.id().equals(replacement.id()) ? replacement : item);
        job.setDownloadQueue(queue);
    }

    private DownloadPreferences preferencesOrDefault(DownloadPreferences preferences) {
        return preferences != null ? preferences : config.getDownload().toPreferences();
    }

    private static String videoIdFor(SongMatchResult result) {
        Song original = result.originalSong();
        if (original.platform() == Platform.YOUTUBE_MUSIC && original.platformId() != null) {
            return original.platformId();
        }
        return result.matches().stream()
                .filter(candidate -> candidate.platform() == Platform.YOUTUBE_MUSIC)
                .map(MatchCandidate::platformId)
                .findFirst()
                .orElse(null);
    }

    private static String firstError(DownloadJob job) {
        return job.getDownloadQueue().stream()
                .map(DownloadQueueItem::error)
                .filter(error -> error != null && !error.isBlank())
                .findFirst()
                .orElse("unknown error");
    }
}
