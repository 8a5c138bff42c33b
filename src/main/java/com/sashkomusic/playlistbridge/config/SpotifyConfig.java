package com.sashkomusic.playlistbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "spotify")
public class SpotifyConfig {
    private String apiBaseUrl = "https://api.spotify.com/v1";
    private String accountsUrl = "https://accounts.spotify.com/api/token";
    private String clientId;
    private String clientSecret;
}
