package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DownloadQueueItem(
        String id,
        String songId,
        String title,
        String artist,
        String album,
        DownloadService service,
        DownloadItemStatus status,
        String serviceJobId,
        Integer progress,
        String error,
        String downloadedPath,
        boolean needsManualOrganization,
        Boolean availableInLibrary
) {

    public static DownloadQueueItem failed(String id, Song song, DownloadService service, String error) {
        return DownloadQueueItem.builder()
                .id(id)
                .songId(song.platformId())
                .title(song.title())
                .artist(song.artist())
                .album(song.album())
                .service(service)
                .status(DownloadItemStatus.FAILED)
                .error(error)
                .build();
    }

    public Song toSong() {
        return new Song(title, artist, album, null, null, null, null, songId, null);
    }
}
