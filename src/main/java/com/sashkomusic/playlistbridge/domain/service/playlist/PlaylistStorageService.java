package com.sashkomusic.playlistbridge.domain.service.playlist;

import com.sashkomusic.playlistbridge.domain.entity.PlaylistSong;
import com.sashkomusic.playlistbridge.domain.entity.UserPlaylist;
import com.sashkomusic.playlistbridge.domain.exception.DuplicatePlaylistNameException;
import com.sashkomusic.playlistbridge.domain.exception.PlaylistNotFoundException;
import com.sashkomusic.playlistbridge.domain.model.CommitResult;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.repository.PlaylistSongRepository;
import com.sashkomusic.playlistbridge.domain.repository.UserPlaylistRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlaylistStorageService {

    private final UserPlaylistRepository playlistRepository;
    private final PlaylistSongRepository songRepository;

    public List<UserPlaylist> listPlaylists(String userId) {
        return playlistRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public UserPlaylist getPlaylist(String userId, String playlistId) {
        return playlistRepository.findByIdAndUserId(playlistId, userId)
                .orElseThrow(() -> new PlaylistNotFoundException("Playlist not found: " + playlistId));
    }

    public List<PlaylistSong> listSongs(String playlistId) {
        return songRepository.findByPlaylistIdOrderByPositionAsc(playlistId);
    }

    public boolean nameTaken(String userId, String name) {
        return playlistRepository.existsByUserIdAndName(userId, name);
    }

    @Transactional
    public UserPlaylist createPlaylist(String userId, String name, String description) {
        if (nameTaken(userId, name)) {
            throw new DuplicatePlaylistNameException("A playlist named '" + name + "' already exists");
        }
        UserPlaylist playlist = playlistRepository.save(new UserPlaylist(userId, name, description));
        log.info("Created playlist '{}' (id={}) for user {}", name, playlist.getId(), userId);
        return playlist;
    }

    /**
     * Appends resolved songs after the current last position, in the given order.
     * Songs already in the playlist, or repeated within {@code songs}, are counted as duplicates.
     */
    @Transactional
    public CommitResult appendSongs(String playlistId, List<Song> songs) {
        UserPlaylist playlist = playlistRepository.findById(playlistId)
                .orElseThrow(() -> new PlaylistNotFoundException("Playlist not found: " + playlistId));

        int position = songRepository.findMaxPosition(playlistId) + 1;
        Set<String> seen = new HashSet<>();
        int added = 0;
        int duplicates = 0;

        for (Song song : songs) {
            Platform platform = song.platform() != null ? song.platform() : Platform.NAVIDROME;
            String key = platform.getValue() + ":" + song.platformId();
            if (!seen.add(key) || songRepository.existsByPlaylistIdAndPlatformAndSongId(playlistId, platform, song.platformId())) {
                log.debug("Skipping duplicate {} in playlist {}", key, playlistId);
                duplicates++;
                continue;
            }
            PlaylistSong entry = new PlaylistSong(playlistId, platform, song.platformId(), song.displayName(), position++);
            entry.setIsrc(song.hasIsrc() ? song.isrc() : null);
            songRepository.save(entry);
            added++;
        }

        playlist.setSongCount((int) songRepository.countByPlaylistId(playlistId));
        playlist.setUpdatedAt(Instant.now());
        playlistRepository.save(playlist);

        log.info("Appended {} songs to playlist {} ({} duplicates skipped)", added, playlistId, duplicates);
        return new CommitResult(playlistId, added, duplicates);
    }
}
