package com.sashkomusic.playlistbridge.web;

import com.sashkomusic.playlistbridge.domain.entity.ExportJob;
import com.sashkomusic.playlistbridge.domain.exception.UnsupportedFormatException;
import com.sashkomusic.playlistbridge.domain.model.ExportDownload;
import com.sashkomusic.playlistbridge.domain.service.exporting.ExportJobService;
import com.sashkomusic.playlistbridge.domain.service.playlist.PlaylistStorageService;
import com.sashkomusic.playlistbridge.web.dto.ExportJobResponse;
import com.sashkomusic.playlistbridge.web.dto.ExportPlaylistRequest;
import com.sashkomusic.playlistbridge.web.dto.PlaylistResponse;
import com.sashkomusic.playlistbridge.web.dto.PlaylistSongResponse;
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

import java.util.List;

import static com.sashkomusic.playlistbridge.web.ImportController.USER_HEADER;

@Slf4j
@RestController
@RequestMapping("/api/playlists")
@RequiredArgsConstructor
public class PlaylistController {

    private final PlaylistStorageService playlistStorage;
    private final ExportJobService exportJobService;

    @GetMapping
    public ResponseEntity<List<PlaylistResponse>> listPlaylists(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(playlistStorage.listPlaylists(userId).stream()
                .map(PlaylistResponse::from)
                .toList());
    }

    @GetMapping("/{playlistId}/songs")
    public ResponseEntity<List<PlaylistSongResponse>> listSongs(@RequestHeader(USER_HEADER) String userId,
                                                                @PathVariable String playlistId) {
        playlistStorage.getPlaylist(userId, playlistId);
        return ResponseEntity.ok(playlistStorage.listSongs(playlistId).stream()
                .map(PlaylistSongResponse::from)
                .toList());
    }

    @PostMapping("/{playlistId}/exports")
    public ResponseEntity<ExportJobResponse> exportPlaylist(@RequestHeader(USER_HEADER) String userId,
                                                            @PathVariable String playlistId,
                                                            @RequestBody ExportPlaylistRequest request) {
        if (request.format() == null) {
            throw new UnsupportedFormatException("Export format is required");
        }
        ExportJob job = exportJobService.exportPlaylist(userId, playlistId, request.format(), request.toOptions());
        return ResponseEntity.ok(ExportJobResponse.from(job));
    }

    @GetMapping("/exports/{exportId}")
    public ResponseEntity<ExportJobResponse> getExport(@RequestHeader(USER_HEADER) String userId,
                                                       @PathVariable String exportId) {
        return ResponseEntity.ok(ExportJobResponse.from(exportJobService.getExportJob(userId, exportId)));
    }

    @GetMapping("/exports/{exportId}/download")
    public ResponseEntity<byte[]> downloadExport(@RequestHeader(USER_HEADER) String userId,
                                                 @PathVariable String exportId) {
        ExportDownload download = exportJobService.downloadExport(userId, exportId);
        log.info("Serving export {} as {}", exportId, download.filename());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + download.filename() + "\"")
                .contentType(MediaType.parseMediaType(download.mimeType()))
                .body(download.content());
    }
}
