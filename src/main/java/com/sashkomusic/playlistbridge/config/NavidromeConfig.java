package com.sashkomusic.playlistbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "navidrome")
public class NavidromeConfig {
    private String baseUrl;
    private String username;
    private String password;
    private String apiVersion = "1.16.1";
    private String clientName = "sm-playlist-bridge";
}
