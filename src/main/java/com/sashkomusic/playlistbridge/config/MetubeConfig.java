package com.sashkomusic.playlistbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "metube")
public class MetubeConfig {
    private String baseUrl;
    /** Download directory as seen by the fetcher; reported paths are resolved against it. */
    private String downloadDir = "/downloads";
    private String defaultFormat = "mp3";
    private String defaultQuality = "best";
    /** Sub-folder of the fetcher's download directory; empty means its root. */
    private String folder;
    private int batchSize = 5;
}
