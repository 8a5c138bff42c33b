package com.sashkomusic.playlistbridge.messaging.producer;

import com.sashkomusic.playlistbridge.messaging.producer.dto.ImportJobCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ImportJobResultProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private static final String TOPIC = "playlist-import-complete";

    public void send(ImportJobCompleteDto message) {
        log.info("Sending import result to Kafka: importJobId={}, status={}, added={}",
                message.jobId(), message.status(), message.addedSongs());

        kafkaTemplate.send(TOPIC, message.jobId(), message);
    }
}
