package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Canonical song as parsed from a playlist file or returned by a catalog.
 * Resolving a song against a catalog produces a new value; parsed songs are never mutated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Song(
        String title,
        String artist,
        String album,
        Integer duration,
        Integer trackNumber,
        String isrc,
        Platform platform,
        String platformId,
        String url
) {

    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    public static final String UNKNOWN_TITLE = "Unknown Title";

    public static Song of(String title, String artist) {
        return new Song(title, artist, null, null, null, null, null, null, null);
    }

    public Song withResolution(Platform platform, String platformId, String url) {
        return new Song(title, artist, album, duration, trackNumber, isrc, platform, platformId, url);
    }

    public Song withDetails(String album, Integer duration, String isrc) {
        return new Song(title, artist, album, duration, trackNumber, isrc, platform, platformId, url);
    }

    @JsonIgnore
    public String displayName() {
        return artist + " - " + title;
    }

    @JsonIgnore
    public boolean hasIsrc() {
        return isrc != null && !isrc.isBlank();
    }

    @JsonIgnore
    public boolean hasAlbum() {
        return album != null && !album.isBlank();
    }
}
