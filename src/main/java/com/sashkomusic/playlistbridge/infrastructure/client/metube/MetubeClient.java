package com.sashkomusic.playlistbridge.infrastructure.client.metube;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.playlistbridge.config.MetubeConfig;
import com.sashkomusic.playlistbridge.domain.exception.DownloadBackendException;
import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.port.TrackFetcherPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MeTube HTTP API. MeTube keys downloads by their URL, which doubles as the service job id.
 */
@Slf4j
@Component
public class MetubeClient implements TrackFetcherPort {

    private final RestClient restClient;
    private final MetubeConfig config;
    private final ObjectMapper objectMapper;

    public MetubeClient(RestClient.Builder restClientBuilder, MetubeConfig config, ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.build();
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public String enqueue(FetchRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", request.source());
        payload.put("quality", request.quality() != null ? request.quality() : config.getDefaultQuality());
        payload.put("format", request.format() != null ? request.format() : config.getDefaultFormat());
        String folder = request.folder() != null ? request.folder() : config.getFolder();
        if (folder != null && !folder.isEmpty()) {
            payload.put("folder", folder);
        }
        if (request.namePrefix() != null) {
            payload.put("custom_name_prefix", request.namePrefix());
        }
        payload.put("auto_start", true);

        JsonNode response = post("/add", payload);
        if (response != null && "error".equals(response.path("status").asText())) {
            throw new DownloadBackendException("MeTube rejected " + request.source() + ": "
                    + response.path("msg").asText("unknown error"));
        }
        log.info("Added {} to MeTube", request.source());
        return request.source();
    }

    @Override
    public boolean cancel(String serviceJobId) {
        boolean queued = getQueue().stream().anyMatch(entry -> serviceJobId.equals(entry.serviceJobId()));
        if (!queued) {
            return false;
        }
        JsonNode response = post("/delete", Map.of("ids", List.of(serviceJobId), "where", "queue"));
        return response == null || !"error".equals(response.path("status").asText());
    }

    @Override
    public List<BackendQueueEntry> getQueue() {
        JsonNode history = history();
        List<BackendQueueEntry> entries = new ArrayList<>();
        entries.addAll(toEntries(history.path("queue")));
        entries.addAll(toEntries(history.path("pending")));
        if (history.isArray()) {
            entries.addAll(toEntries(history).stream().filter(entry -> !entry.status().isTerminal()).toList());
        }
        return entries;
    }

    @Override
    public List<BackendQueueEntry> getDone() {
        JsonNode history = history();
        if (history.isArray()) {
            return toEntries(history).stream().filter(entry -> entry.status().isTerminal()).toList();
        }
        return toEntries(history.path("done"));
    }

    @Override
    public boolean isAvailable() {
        if (config.getBaseUrl() == null) {
            return false;
        }
        try {
            restClient.get().uri(uri("/version")).retrieve().toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.warn("MeTube is not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public int maxBatchSize() {
        return config.getBatchSize();
    }

    private JsonNode history() {
        try {
            JsonNode body = restClient.get().uri(uri("/history")).retrieve().body(JsonNode.class);
            return body == null ? objectMapper.createObjectNode() : body;
        } catch (RestClientException e) {
            throw new DownloadBackendException("MeTube history request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode post(String path, Object payload) {
        try {
            return restClient.post()
                    .uri(uri(path))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new DownloadBackendException("MeTube request " + path + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * MeTube returns each section either as an array or as an object keyed by URL.
     */
    private List<BackendQueueEntry> toEntries(JsonNode section) {
        List<BackendQueueEntry> entries = new ArrayList<>();
        if (section == null || section.isMissingNode() || section.isNull()) {
            return entries;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = section.isObject() ? section.fields() : null;
        if (fields != null) {
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.add(toEntry(field.getKey(), field.getValue()));
            }
        } else if (section.isArray()) {
            for (JsonNode node : section) {
                entries.add(toEntry(null, node));
            }
        }
        return entries;
    }

    private BackendQueueEntry toEntry(String key, JsonNode node) {
        MetubeDownload download = objectMapper.convertValue(node, MetubeDownload.class);
        String id = download.url() != null ? download.url() : download.id() != null ? download.id() : key;
        DownloadItemStatus status = status(download.status());
        return new BackendQueueEntry(
                DownloadService.SINGLE_TRACK_FETCHER,
                id,
                null,
                download.title(),
                status,
                status == DownloadItemStatus.COMPLETED ? Integer.valueOf(100)
                        : download.percent() != null ? (int) Math.round(download.percent()) : null,
                path(download),
                status == DownloadItemStatus.FAILED ? download.msg() : null);
    }

    private String path(MetubeDownload download) {
        if (download.filename() == null) {
            return null;
        }
        StringBuilder path = new StringBuilder(config.getDownloadDir() == null ? "" : config.getDownloadDir());
        if (download.folder() != null && !download.folder().isEmpty()) {
            path.append('/').append(download.folder());
        }
        return path.append('/').append(download.filename()).toString();
    }

    static DownloadItemStatus status(String metubeStatus) {
        if (metubeStatus == null) {
            return DownloadItemStatus.QUEUED;
        }
        return switch (metubeStatus) {
            case "finished" -> DownloadItemStatus.COMPLETED;
            case "error" -> DownloadItemStatus.FAILED;
            case "downloading", "preparing" -> DownloadItemStatus.DOWNLOADING;
            default -> DownloadItemStatus.QUEUED;
        };
    }

    private URI uri(String path) {
        if (config.getBaseUrl() == null) {
            throw new DownloadBackendException("MeTube URL not configured");
        }
        return UriComponentsBuilder.fromUriString(config.getBaseUrl()).path(path).build().toUri();
    }
}
