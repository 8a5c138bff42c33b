package com.sashkomusic.playlistbridge.domain.repository;

import com.sashkomusic.playlistbridge.domain.entity.PlatformCredential;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PlatformCredentialRepository extends JpaRepository<PlatformCredential, Long> {

    Optional<PlatformCredential> findByUserIdAndPlatform(String userId, Platform platform);
}
