package com.sashkomusic.playlistbridge.messaging.consumer;

import com.sashkomusic.playlistbridge.domain.entity.ImportJob;
import com.sashkomusic.playlistbridge.domain.service.importing.ImportJobService;
import com.sashkomusic.playlistbridge.messaging.consumer.dto.ImportPlaylistTaskDto;
import com.sashkomusic.playlistbridge.messaging.producer.ImportJobResultProducer;
import com.sashkomusic.playlistbridge.messaging.producer.dto.ImportJobCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ImportPlaylistListener {

    private final ImportJobService importJobService;
    private final ImportJobResultProducer resultProducer;

    @KafkaListener(topics = "playlist-import-tasks")
    public void handleImportTask(ImportPlaylistTaskDto task) {
        log.info("Received playlist import task: userId={}, format={}, filename={}, targetPlaylistId={}",
                task.userId(), task.format(), task.filename(), task.targetPlaylistId());

        try {
            ImportJob job = importJobService.startImport(task.toRequest());
            log.info("Import task accepted as importJobId={} ({} songs)", job.getId(), job.getTotalSongs());

        } catch (Exception ex) {
            log.error("Rejected playlist import task for user {}: {}", task.userId(), ex.getMessage(), ex);
            resultProducer.send(ImportJobCompleteDto.rejected(task.userId(), task.targetPlaylistId(), ex.getMessage()));
        }
    }
}
