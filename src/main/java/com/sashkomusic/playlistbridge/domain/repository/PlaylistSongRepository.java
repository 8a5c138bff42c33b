package com.sashkomusic.playlistbridge.domain.repository;

import com.sashkomusic.playlistbridge.domain.entity.PlaylistSong;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PlaylistSongRepository extends JpaRepository<PlaylistSong, String> {

    List<PlaylistSong> findByPlaylistIdOrderByPositionAsc(String playlistId);

    boolean existsByPlaylistIdAndPlatformAndSongId(String playlistId, Platform platform, String songId);

    @Query("SELECT COALESCE(MAX(s.position), -1) FROM PlaylistSong s WHERE s.playlistId = :playlistId")
    int findMaxPosition(@Param("playlistId") String playlistId);

    long countByPlaylistId(String playlistId);
}
