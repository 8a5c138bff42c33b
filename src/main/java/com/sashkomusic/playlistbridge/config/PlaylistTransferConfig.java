package com.sashkomusic.playlistbridge.config;

import com.sashkomusic.playlistbridge.domain.model.DownloadPreferences;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "playlist-transfer")
public class PlaylistTransferConfig {

    private Http http = new Http();
    private Matching matching = new Matching();
    private Download download = new Download();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Matching {
        /** Songs matched in parallel within a single import job. */
        private int concurrency = 6;
        private int maxCandidates = 10;
        /** Minimum score lead the top candidate needs over the runner-up to be auto-accepted. */
        private int ambiguityGap = 5;
        private int searchLimit = 20;
        private Duration searchTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Download {
        private DownloadService defaultService = DownloadService.CATALOG_MANAGER;
        private boolean preferCatalogForAlbums = true;
        private boolean preferFetcherForSingles = true;
        private String fetcherFormat = "mp3";
        private String fetcherQuality = "best";
        private long monitorInterval = 60000;

        public DownloadPreferences toPreferences() {
            return new DownloadPreferences(defaultService, preferCatalogForAlbums, preferFetcherForSingles,
                    fetcherFormat, fetcherQuality);
        }
    }
}
