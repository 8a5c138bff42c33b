package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.domain.exception.DownloadBackendException;
import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadReport;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Routes download requests to the catalog manager or the single-track fetcher and
 * merges their state. Every request is submitted on its own: a back-end error fails
 * that item only.
 */
@Slf4j
@Service
public class DownloadOrchestrator {

    private final Map<DownloadService, DownloadHandler> handlers = new EnumMap<>(DownloadService.class);

    public DownloadOrchestrator(List<DownloadHandler> handlers) {
        handlers.forEach(handler -> this.handlers.put(handler.service(), handler));
    }

    public DownloadService route(DownloadRequest request, DownloadPreferences preferences) {
        DownloadService chosen = preferences.defaultService();
        if (preferences.preferCatalogForAlbums() && request.albumContext()) {
            chosen = DownloadService.CATALOG_MANAGER;
        } else if (preferences.preferFetcherForSingles() && !request.albumContext()
                && TrackFetcherDownloadHandler.hasVideoSource(request)) {
            chosen = DownloadService.SINGLE_TRACK_FETCHER;
        }

        if (!handlers.containsKey(chosen) && !handlers.isEmpty()) {
            DownloadService fallback = handlers.keySet().iterator().next();
            log.debug("No handler for {}, falling back to {}", chosen, fallback);
            return fallback;
        }
        return chosen;
    }

    public DownloadQueueItem queueSingle(DownloadRequest request, DownloadService service,
                                         DownloadPreferences preferences) {
        DownloadService target = service != null ? service : route(request, preferences);
        return submit(UUID.randomUUID().toString(), target, request, preferences);
    }

    /**
     * Queues every request, chunked per back-end batch limit. The returned items are in
     * request order.
     */
    public List<DownloadQueueItem> queueBatch(List<DownloadRequest> requests, DownloadPreferences preferences) {
        DownloadQueueItem[] items = new DownloadQueueItem[requests.size()];

        Map<DownloadService, List<Integer>> byService = new LinkedHashMap<>();
        for (int i = 0; i < requests.size(); i++) {
            byService.computeIfAbsent(route(requests.get(i), preferences), s -> new ArrayList<>()).add(i);
        }

        byService.forEach((service, indexes) -> {
            int chunkSize = Math.max(1, batchSize(service));
            for (int from = 0; from < indexes.size(); from += chunkSize) {
                List<Integer> chunk = indexes.subList(from, Math.min(from + chunkSize, indexes.size()));
                log.info("Submitting chunk of {} item(s) to {}", chunk.size(), service.getValue());
                for (int index : chunk) {
                    items[index] = submit(UUID.randomUUID().toString(), service, requests.get(index), preferences);
                }
            }
        });

        return Arrays.asList(items);
    }

    public DownloadQueueStatus getQueueStatus() {
        Map<DownloadService, String> unavailable = new EnumMap<>(DownloadService.class);
        List<BackendQueueEntry> catalogQueue = entries(DownloadService.CATALOG_MANAGER, true, unavailable);
        List<BackendQueueEntry> catalogHistory = entries(DownloadService.CATALOG_MANAGER, false, unavailable);
        List<BackendQueueEntry> fetcherQueue = entries(DownloadService.SINGLE_TRACK_FETCHER, true, unavailable);
        List<BackendQueueEntry> fetcherDone = entries(DownloadService.SINGLE_TRACK_FETCHER, false, unavailable);
        return new DownloadQueueStatus(catalogQueue, catalogHistory, fetcherQueue, fetcherDone, unavailable);
    }

    /**
     * Live entries of one back-end, active first. Throws when the back-end cannot be reached.
     */
    public List<BackendQueueEntry> backendEntries(DownloadService service) {
        DownloadHandler handler = handler(service);
        List<BackendQueueEntry> entries = new ArrayList<>(handler.activeEntries());
        entries.addAll(handler.finishedEntries());
        return entries;
    }

    /**
     * Best effort. Items that already finished, or that the back-end no longer knows, are left alone.
     */
    public boolean cancel(DownloadQueueItem item) {
        if (item.status().isTerminal() || item.serviceJobId() == null) {
            return false;
        }
        try {
            boolean cancelled = handler(item.service()).cancel(item.serviceJobId());
            log.info("Cancel of {} item {} (serviceJobId={}): {}", item.service().getValue(), item.id(),
                    item.serviceJobId(), cancelled ? "accepted" : "ignored");
            return cancelled;
        } catch (DownloadBackendException e) {
            log.warn("Failed to cancel item {} on {}: {}", item.id(), item.service().getValue(), e.getMessage());
            return false;
        }
    }

    public Map<DownloadService, Boolean> availability() {
        Map<DownloadService, Boolean> result = new EnumMap<>(DownloadService.class);
        handlers.forEach((service, handler) -> result.put(service, handler.isAvailable()));
        return result;
    }

    public DownloadReport generateReport(List<DownloadQueueItem> items) {
        Map<DownloadService, DownloadReport.ServiceCounts> byService = new EnumMap<>(DownloadService.class);
        for (DownloadService service : DownloadService.values()) {
            List<DownloadQueueItem> owned = items.stream().filter(item -> item.service() == service).toList();
            byService.put(service, new DownloadReport.ServiceCounts(
                    count(owned, DownloadItemStatus.QUEUED),
                    count(owned, DownloadItemStatus.DOWNLOADING),
                    count(owned, DownloadItemStatus.COMPLETED),
                    count(owned, DownloadItemStatus.FAILED)));
        }

        DownloadReport.Summary summary = new DownloadReport.Summary(
                items.size(),
                count(items, DownloadItemStatus.QUEUED),
                count(items, DownloadItemStatus.DOWNLOADING),
                count(items, DownloadItemStatus.COMPLETED),
                count(items, DownloadItemStatus.FAILED));

        List<DownloadQueueItem> failed = items.stream()
                .filter(item -> item.status() == DownloadItemStatus.FAILED)
                .toList();
        List<DownloadQueueItem> manual = items.stream()
                .filter(DownloadQueueItem::needsManualOrganization)
                .filter(item -> item.status() == DownloadItemStatus.COMPLETED)
                .toList();

        return new DownloadReport(summary, byService, failed, manual);
    }

    private DownloadQueueItem submit(String itemId, DownloadService service, DownloadRequest request,
                                     DownloadPreferences preferences) {
        try {
            return handler(service).submit(itemId, request, preferences);
        } catch (RuntimeException e) {
            log.warn("Failed to queue '{}' on {}: {}", request.song().displayName(), service.getValue(), e.getMessage());
            log.debug("Download submit error details", e);
            return DownloadQueueItem.failed(itemId, request.song(), service, e.getMessage());
        }
    }

    private List<BackendQueueEntry> entries(DownloadService service, boolean active,
                                            Map<DownloadService, String> unavailable) {
        DownloadHandler handler = handlers.get(service);
        if (handler == null) {
            unavailable.put(service, "Not configured");
            return List.of();
        }
        try {
            return active ? handler.activeEntries() : handler.finishedEntries();
        } catch (RuntimeException e) {
            log.warn("Could not read {} {}: {}", service.getValue(), active ? "queue" : "history", e.getMessage());
            unavailable.putIfAbsent(service, e.getMessage());
            return List.of();
        }
    }

    private int batchSize(DownloadService service) {
        DownloadHandler handler = handlers.get(service);
        return handler == null ? 1 : handler.maxBatchSize();
    }

    private DownloadHandler handler(DownloadService service) {
        DownloadHandler handler = handlers.get(service);
        if (handler == null) {
            throw new DownloadBackendException("No download back-end configured for " + service.getValue());
        }
        return handler;
    }

    private static int count(List<DownloadQueueItem> items, DownloadItemStatus status) {
        return (int) items.stream().filter(item -> item.status() == status).count();
    }
}
