package com.sashkomusic.playlistbridge.infrastructure.client.navidrome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.sashkomusic.playlistbridge.config.NavidromeConfig;
import com.sashkomusic.playlistbridge.domain.exception.CatalogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

@Slf4j
@Component
public class NavidromeAuthClient {

    /** Navidrome does not report token lifetime; sessions are treated as valid for an hour. */
    static final Duration SESSION_LIFETIME = Duration.ofHours(1);

    private final RestClient restClient;
    private final NavidromeConfig config;
    private final Clock clock;

    public NavidromeAuthClient(RestClient.Builder restClientBuilder, NavidromeConfig config, Clock clock) {
        this.restClient = restClientBuilder.build();
        this.config = config;
        this.clock = clock;
    }

    public NavidromeSession login() {
        if (config.getBaseUrl() == null || config.getUsername() == null || config.getPassword() == null
                || config.getPassword().isEmpty()) {
            throw new CatalogException("Navidrome credentials incomplete");
        }

        LoginResponse response;
        try {
            response = restClient.post()
                    .uri(UriComponentsBuilder.fromUriString(config.getBaseUrl()).path("/auth/login").build().toUri())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("username", config.getUsername(), "password", config.getPassword()))
                    .retrieve()
                    .body(LoginResponse.class);
        } catch (RestClientException e) {
            throw new CatalogException("Navidrome login failed: " + e.getMessage(), e);
        }

        if (response == null || response.token() == null || response.id() == null) {
            throw new CatalogException("Navidrome login returned no token or id");
        }
        log.info("Authenticated with Navidrome as {}", config.getUsername());
        return new NavidromeSession(response.token(), response.id(), response.subsonicToken(),
                response.subsonicSalt(), clock.instant().plus(SESSION_LIFETIME));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LoginResponse(String id, String token, String subsonicToken, String subsonicSalt) {
    }
}
