package com.sashkomusic.playlistbridge.web;

import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.model.MatchReport;
import com.sashkomusic.playlistbridge.domain.model.ValidationResult;
import com.sashkomusic.playlistbridge.domain.service.importing.ImportJobService;
import com.sashkomusic.playlistbridge.web.dto.FinalizeReviewRequest;
import com.sashkomusic.playlistbridge.web.dto.ImportJobResponse;
import com.sashkomusic.playlistbridge.web.dto.ImportPlaylistRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Slf4j
@RestController
@RequestMapping("/api/playlists/imports")
@RequiredArgsConstructor
public class ImportController {

    static final String USER_HEADER = "X-User-Id";

    private final ImportJobService importJobService;

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestHeader(USER_HEADER) String userId,
                                                     @RequestBody ImportPlaylistRequest request) {
        return ResponseEntity.ok(importJobService.validate(request.toRequest(userId)));
    }

    @PostMapping
    public ResponseEntity<ImportJobResponse> startImport(@RequestHeader(USER_HEADER) String userId,
                                                         @RequestBody ImportPlaylistRequest request) {
        ImportJob job = importJobService.startImport(request.toRequest(userId));
        log.info("Accepted importJobId={} songCount={}", job.getId(), job.getTotalSongs());

        return ResponseEntity.accepted()
                .location(ServletUriComponentsBuilder.fromCurrentRequest()
                        .path("/{jobId}")
                        .buildAndExpand(job.getId())
                        .toUri())
                .body(ImportJobResponse.from(job));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ImportJobResponse> getImportJob(@RequestHeader(USER_HEADER) String userId,
                                                          @PathVariable String jobId) {
        return ResponseEntity.ok(ImportJobResponse.from(importJobService.getImportJob(userId, jobId)));
    }

    @GetMapping("/{jobId}/report")
    public ResponseEntity<MatchReport> getMatchReport(@RequestHeader(USER_HEADER) String userId,
                                                      @PathVariable String jobId) {
        return ResponseEntity.ok(importJobService.getMatchReport(userId, jobId));
    }

    @GetMapping("/{jobId}/results.csv")
    public ResponseEntity<String> exportMatchResults(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable String jobId) {
        String csv = importJobService.exportMatchResults(userId, jobId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=match-results-" + jobId + ".csv")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @PostMapping("/{jobId}/review")
    public ResponseEntity<ImportJobResponse> finalizeReview(@RequestHeader(USER_HEADER) String userId,
                                                            @PathVariable String jobId,
                                                            @RequestBody FinalizeReviewRequest request) {
        ImportJob job = importJobService.finalizeReview(userId, jobId, request.decisionsOrEmpty());
        return ResponseEntity.ok(ImportJobResponse.from(job));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<ImportJobResponse> cancelImport(@RequestHeader(USER_HEADER) String userId,
                                                          @PathVariable String jobId) {
        return ResponseEntity.ok(ImportJobResponse.from(importJobService.cancel(userId, jobId)));
    }
}
