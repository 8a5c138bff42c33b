package com.sashkomusic.playlistbridge.domain.entity;

import com.sashkomusic.playlistbridge.domain.model.Platform;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "playlist_songs", indexes = {
        @Index(name = "playlist_songs_playlist_position_idx", columnList = "playlist_id, position")
})
@Getter
@Setter
public class PlaylistSong {

    @Id
    private String id;

    @Column(name = "playlist_id", nullable = false)
    private String playlistId;

    @Column(name = "song_id", nullable = false)
    private String songId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Platform platform = Platform.NAVIDROME;

    /**
     * Denormalized "Artist - Title", used when the catalog cannot be reached.
     */
    @Column(name = "song_artist_title", nullable = false)
    private String songArtistTitle;

    private String isrc;

    @Column(nullable = false)
    private int position;

    @Column(name = "added_at", nullable = false)
    private Instant addedAt;

    public PlaylistSong() {
    }

    public PlaylistSong(String playlistId, Platform platform, String songId, String songArtistTitle, int position) {
        this.id = UUID.randomUUID().toString();
        this.playlistId = playlistId;
        this.platform = platform;
        this.songId = songId;
        this.songArtistTitle = songArtistTitle;
        this.position = position;
        this.addedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlaylistSong)) return false;
        PlaylistSong other = (PlaylistSong) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
