package com.sashkomusic.playlistbridge.infrastructure.client.navidrome;

import com.sashkomusic.playlistbridge.config.NavidromeConfig;
import com.sashkomusic.playlistbridge.domain.exception.CatalogException;
import com.sashkomusic.playlistbridge.domain.port.LibraryScanPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class NavidromeClient implements LibraryScanPort {

    private static final List<String> SEARCH_PARAMS = List.of("title", "fullText", "name");
    private static final ParameterizedTypeReference<List<NavidromeSong>> SONG_LIST = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;
    private final NavidromeConfig config;
    private final NavidromeSessionCache sessions;

    public NavidromeClient(RestClient.Builder restClientBuilder, NavidromeConfig config, NavidromeSessionCache sessions) {
        this.restClient = restClientBuilder.build();
        this.config = config;
        this.sessions = sessions;
    }

    @Override
    public void triggerScan(String folderPath) {
        try {
            URI uri = buildScanUri(folderPath);

            log.info("Triggering Navidrome scan for folder: {}", folderPath == null ? "<library>" : folderPath);
            log.debug("Scan request URL: {}", uri.getPath());

            restClient.get()
                    .uri(uri)
                    .retrieve()
                    .toBodilessEntity();

            log.info("Triggered Navidrome scan for: {}", folderPath == null ? "<library>" : folderPath);

        } catch (RuntimeException e) {
            log.warn("Failed to trigger Navidrome scan for {}: {}. Navidrome will scan automatically on schedule.",
                    folderPath, e.getMessage());
            log.debug("Navidrome scan error details", e);
        }
    }

    /**
     * Searches songs by title, then full text, then name, returning the first non-empty result.
     * Throws only when every attempt failed.
     */
    public List<NavidromeSong> searchSongs(String query, int start, int limit) {
        CatalogException lastError = null;
        int failures = 0;
        for (String param : SEARCH_PARAMS) {
            URI uri = apiUri("/api/song")
                    .queryParam(param, query)
                    .queryParam("_start", start)
                    .queryParam("_end", start + limit - 1)
                    .encode()
                    .build()
                    .toUri();
            try {
                List<NavidromeSong> songs = get(uri, SONG_LIST);
                if (songs != null && !songs.isEmpty()) {
                    log.debug("Navidrome search '{}' by {} returned {} songs", query, param, songs.size());
                    return songs;
                }
            } catch (CatalogException e) {
                log.debug("Navidrome search '{}' by {} failed: {}", query, param, e.getMessage());
                lastError = e;
                failures++;
            }
        }

        if (failures == SEARCH_PARAMS.size()) {
            throw lastError;
        }
        return List.of();
    }

    public Optional<NavidromeSong> getSong(String id) {
        URI uri = apiUri("/api/song/{id}").buildAndExpand(id).toUri();
        try {
            return Optional.ofNullable(get(uri, new ParameterizedTypeReference<NavidromeSong>() {
            }));
        } catch (CatalogException e) {
            if (e.getCause() instanceof HttpClientErrorException.NotFound) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Authenticated GET against the native API. A 401 drops the cached session and the request
     * is retried once with a fresh one.
     */
    <T> T get(URI uri, ParameterizedTypeReference<T> type) {
        for (int attempt = 0; ; attempt++) {
            NavidromeSession session = sessions.current();
            try {
                return restClient.get()
                        .uri(uri)
                        .header("x-nd-authorization", "Bearer " + session.token())
                        .header("x-nd-client-unique-id", session.clientId())
                        .retrieve()
                        .body(type);
            } catch (HttpClientErrorException.Unauthorized e) {
                sessions.invalidate(session);
                if (attempt >= 1) {
                    throw new CatalogException("Navidrome rejected credentials for " + uri.getPath(), e);
                }
                log.debug("Navidrome session rejected, re-authenticating");
            } catch (RestClientException e) {
                throw new CatalogException("Navidrome request " + uri.getPath() + " failed: " + e.getMessage(), e);
            }
        }
    }

    private UriComponentsBuilder apiUri(String path) {
        return UriComponentsBuilder.fromUriString(config.getBaseUrl()).path(path);
    }

    private URI buildScanUri(String folderPath) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromUriString(config.getBaseUrl())
                .path("/rest/startScan")
                .queryParam("u", config.getUsername())
                .queryParam("v", config.getApiVersion())
                .queryParam("c", config.getClientName())
                .queryParam("f", "json");

        NavidromeSession session = sessions.current();
        if (session.subsonicToken() != null && session.subsonicSalt() != null) {
            builder.queryParam("t", session.subsonicToken())
                    .queryParam("s", session.subsonicSalt());
        } else {
            builder.queryParam("p", config.getPassword());
        }

        if (folderPath != null && !folderPath.isEmpty()) {
            builder.queryParam("target", folderPath);
        }

        return builder.encode().build().toUri();
    }
}
