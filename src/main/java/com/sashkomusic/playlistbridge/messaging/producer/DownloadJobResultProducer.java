package com.sashkomusic.playlistbridge.messaging.producer;

import com.sashkomusic.playlistbridge.messaging.producer.dto.DownloadJobCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class DownloadJobResultProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private static final String TOPIC = "playlist-download-complete";

    public void send(DownloadJobCompleteDto message) {
        log.info("Sending download result to Kafka: downloadJobId={}, status={}, completed={}/{}",
                message.jobId(), message.status(), message.completedItems(), message.totalItems());

        kafkaTemplate.send(TOPIC, message.jobId(), message);
    }
}
