package com.sashkomusic.playlistbridge.domain.repository;

import com.sashkomusic.playlistbridge.domain.entity.UserPlaylist;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserPlaylistRepository extends JpaRepository<UserPlaylist, String> {

    List<UserPlaylist> findByUserIdOrderByCreatedAtDesc(String userId);

    Optional<UserPlaylist> findByIdAndUserId(String id, String userId);

    boolean existsByUserIdAndName(String userId, String name);
}
