package com.sashkomusic.playlistbridge.infrastructure.client.spotify;

import com.sashkomusic.playlistbridge.config.SpotifyConfig;
import com.sashkomusic.playlistbridge.domain.exception.CatalogException;
import com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto.SpotifySearchResponse;
import com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto.SpotifyTrack;
import com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto.SpotifyTracksResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Slf4j
@Component
public class SpotifyClient {

    static final int MAX_IDS_PER_REQUEST = 50;
    static final int MAX_SEARCH_LIMIT = 50;

    private final RestClient restClient;
    private final SpotifyConfig config;
    private final SpotifyTokenProvider tokenProvider;

    public SpotifyClient(RestClient.Builder restClientBuilder, SpotifyConfig config, SpotifyTokenProvider tokenProvider) {
        this.restClient = restClientBuilder.build();
        this.config = config;
        this.tokenProvider = tokenProvider;
    }

    public List<SpotifyTrack> searchTracks(String userId, String query, int offset, int limit) {
        URI uri = api("/search")
                .queryParam("type", "track")
                .queryParam("q", query)
                .queryParam("offset", offset)
                .queryParam("limit", Math.min(Math.max(limit, 1), MAX_SEARCH_LIMIT))
                .encode()
                .build()
                .toUri();
        SpotifySearchResponse response = get(userId, uri, SpotifySearchResponse.class);
        return response == null ? List.of() : response.items();
    }

    public List<SpotifyTrack> searchByIsrc(String userId, String isrc) {
        return searchTracks(userId, "isrc:" + isrc, 0, 5);
    }

    public List<SpotifyTrack> getTracks(String userId, List<String> ids) {
        List<SpotifyTrack> tracks = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += MAX_IDS_PER_REQUEST) {
            List<String> chunk = ids.subList(from, Math.min(from + MAX_IDS_PER_REQUEST, ids.size()));
            URI uri = api("/tracks").queryParam("ids", String.join(",", chunk)).encode().build().toUri();
            SpotifyTracksResponse response = get(userId, uri, SpotifyTracksResponse.class);
            if (response != null && response.tracks() != null) {
                response.tracks().stream().filter(Objects::nonNull).forEach(tracks::add);
            }
        }
        return tracks;
    }

    private <T> T get(String userId, URI uri, Class<T> type) {
        String token = tokenProvider.accessToken(userId);
        try {
            return restClient.get()
                    .uri(uri)
                    .header("Authorization", "Bearer " + token)
                    .retrieve()
                    .body(type);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                String retryAfter = e.getResponseHeaders() == null ? null : e.getResponseHeaders().getFirst("Retry-After");
                throw new CatalogException("Spotify rate limited. Retry after " + (retryAfter == null ? "1" : retryAfter)
                        + " seconds", e);
            }
            throw new CatalogException("Spotify API error " + e.getStatusCode().value() + " for " + uri.getPath(), e);
        } catch (RestClientException e) {
            throw new CatalogException("Spotify request " + uri.getPath() + " failed: " + e.getMessage(), e);
        }
    }

    private UriComponentsBuilder api(String path) {
        return UriComponentsBuilder.fromUriString(config.getApiBaseUrl()).path(path);
    }
}
