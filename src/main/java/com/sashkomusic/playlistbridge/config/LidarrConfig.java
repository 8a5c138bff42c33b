package com.sashkomusic.playlistbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "lidarr")
public class LidarrConfig {
    private String baseUrl;
    private String apiKey;
    private int qualityProfileId = 1;
    private int metadataProfileId = 1;
    private String rootFolderPath = "/music";
    private int batchSize = 10;
}
