package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.domain.entity.DownloadJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class DownloadMonitor {

    private final DownloadJobService downloadJobService;

    @Scheduled(fixedDelayString = "${playlist-transfer.download.monitor-interval:60000}")
    public void refreshActiveJobs() {
        List<DownloadJob> active = downloadJobService.activeJobs();
        if (active.isEmpty()) {
            return;
        }

        log.debug("Refreshing {} active download job(s)", active.size());
        for (DownloadJob job : active) {
            try {
                downloadJobService.refresh(job.getId());
            } catch (Exception e) {
                log.error("Failed to refresh downloadJobId={}: {}", job.getId(), e.getMessage(), e);
            }
        }
    }
}
