package com.sashkomusic.playlistbridge.domain.repository;

import com.sashkomusic.playlistbridge.domain.entity.DownloadJob;
import com.sashkomusic.playlistbridge.domain.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DownloadJobRepository extends JpaRepository<DownloadJob, String> {

    Optional<DownloadJob> findByIdAndUserId(String id, String userId);

    List<DownloadJob> findByStatus(JobStatus status);
}
