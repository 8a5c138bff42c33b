package com.sashkomusic.playlistbridge.domain.repository;

import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ImportJobRepository extends JpaRepository<ImportJob, String> {

    Optional<ImportJob> findByIdAndUserId(String id, String userId);
}
