package com.sashkomusic.playlistbridge.web;

import com.sashkomusic.playlistbridge.domain.entity.DownloadJob;
import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadReport;
import com.sashkomusic.playlistbridge.domain.model.DownloadRequest;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.service.download.DownloadJobService;
import com.sashkomusic.playlistbridge.web.dto.DownloadBatchRequest;
import com.sashkomusic.playlistbridge.web.dto.MarkOrganizedRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

import static com.sashkomusic.playlistbridge.web.ImportController.USER_HEADER;

@Slf4j
@RestController
@RequestMapping("/api/playlists")
@RequiredArgsConstructor
public class DownloadController {

    private final DownloadJobService downloadJobService;

    @PostMapping("/downloads")
    public ResponseEntity<DownloadJob> queueBatch(@RequestHeader(USER_HEADER) String userId,
                                                  @RequestBody DownloadBatchRequest request) {
        List<DownloadRequest> requests = request.toRequests();
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("No songs to download");
        }
        DownloadJob job = downloadJobService.queueBatch(userId, requests, request.preferences());
        log.info("Accepted downloadJobId={} itemCount={}", job.getId(), job.getTotalItems());
        return ResponseEntity.ok(job);
    }

    @PostMapping("/downloads/single")
    public ResponseEntity<DownloadJob> queueSingle(@RequestHeader(USER_HEADER) String userId,
                                                   @RequestBody DownloadBatchRequest request) {
        List<DownloadRequest> requests = request.toRequests();
        if (requests.size() != 1) {
            throw new IllegalArgumentException("Exactly one song is required, got " + requests.size());
        }
        DownloadJob job = downloadJobService.queueSingle(userId, requests.get(0), request.service(),
                request.preferences());
        return ResponseEntity.ok(job);
    }

    @PostMapping("/imports/{importJobId}/downloads")
    public ResponseEntity<DownloadJob> downloadMissing(@RequestHeader(USER_HEADER) String userId,
                                                       @PathVariable String importJobId,
                                                       @RequestBody(required = false) DownloadPreferences preferences) {
        return ResponseEntity.ok(downloadJobService.createFromImport(userId, importJobId, preferences));
    }

    @GetMapping("/downloads/queue")
    public ResponseEntity<DownloadQueueStatus> getDownloadQueueStatus() {
        return ResponseEntity.ok(downloadJobService.getQueueStatus());
    }

    @GetMapping("/downloads/availability")
    public ResponseEntity<Map<DownloadService, Boolean>> getAvailability() {
        return ResponseEntity.ok(downloadJobService.availability());
    }

    @GetMapping("/downloads/{jobId}")
    public ResponseEntity<DownloadJob> getDownloadJob(@RequestHeader(USER_HEADER) String userId,
                                                      @PathVariable String jobId) {
        return ResponseEntity.ok(downloadJobService.getJob(userId, jobId));
    }

    @GetMapping("/downloads/{jobId}/report")
    public ResponseEntity<DownloadReport> getDownloadReport(@RequestHeader(USER_HEADER) String userId,
                                                            @PathVariable String jobId) {
        return ResponseEntity.ok(downloadJobService.getReport(userId, jobId));
    }

    @PostMapping("/downloads/{jobId}/items/{itemId}/cancel")
    public ResponseEntity<DownloadJob> cancelDownload(@RequestHeader(USER_HEADER) String userId,
                                                      @PathVariable String jobId,
                                                      @PathVariable String itemId) {
        return ResponseEntity.ok(downloadJobService.cancelItem(userId, jobId, itemId));
    }

    @PostMapping("/downloads/{jobId}/organized")
    public ResponseEntity<DownloadJob> markOrganized(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable String jobId,
                                                     @RequestBody(required = false) MarkOrganizedRequest request) {
        List<String> itemIds = request == null || request.itemIds() == null ? List.of() : request.itemIds();
        return ResponseEntity.ok(downloadJobService.markOrganized(userId, jobId, itemIds));
    }
}
