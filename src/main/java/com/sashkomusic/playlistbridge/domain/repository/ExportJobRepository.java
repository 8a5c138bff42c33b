package com.sashkomusic.playlistbridge.domain.repository;

import com.sashkomusic.playlistbridge.domain.entity.ExportJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExportJobRepository extends JpaRepository<ExportJob, String> {

    Optional<ExportJob> findByIdAndUserId(String id, String userId);
}
