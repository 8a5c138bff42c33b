package com.sashkomusic.playlistbridge.infrastructure.client.spotify;

import com.sashkomusic.playlistbridge.config.SpotifyConfig;
import com.sashkomusic.playlistbridge.domain.entity.PlatformCredential;
import com.sashkomusic.playlistbridge.domain.exception.CatalogException;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.repository.PlatformCredentialRepository;
import com.sashkomusic.playlistbridge.infrastructure.client.spotify.dto.SpotifyTokenResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out a user's Spotify access token, refreshing it through the stored refresh token
 * when it is about to expire. Refreshes for the same user never run concurrently.
 */
@Slf4j
@Component
public class SpotifyTokenProvider {

    static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

    private final RestClient restClient;
    private final SpotifyConfig config;
    private final PlatformCredentialRepository credentialRepository;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    public SpotifyTokenProvider(RestClient.Builder restClientBuilder,
                                SpotifyConfig config,
                                PlatformCredentialRepository credentialRepository,
                                Clock clock) {
        this.restClient = restClientBuilder.build();
        this.config = config;
        this.credentialRepository = credentialRepository;
        this.clock = clock;
    }

    public String accessToken(String userId) {
        PlatformCredential credential = load(userId);
        if (!credential.expiresBefore(clock.instant().plus(REFRESH_MARGIN))) {
            return credential.getAccessToken();
        }

        ReentrantLock lock = refreshLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            credential = load(userId);
            if (!credential.expiresBefore(clock.instant().plus(REFRESH_MARGIN))) {
                return credential.getAccessToken();
            }
            return refresh(credential);
        } finally {
            lock.unlock();
        }
    }

    private String refresh(PlatformCredential credential) {
        if (credential.getRefreshToken() == null) {
            throw new CatalogException("Spotify session for user " + credential.getUserId() + " expired");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", credential.getRefreshToken());

        SpotifyTokenResponse response;
        try {
            response = restClient.post()
                    .uri(config.getAccountsUrl())
                    .header("Authorization", "Basic " + basicCredentials())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(SpotifyTokenResponse.class);
        } catch (RestClientException e) {
            throw new CatalogException("Failed to refresh Spotify token: " + e.getMessage(), e);
        }
        if (response == null || response.accessToken() == null) {
            throw new CatalogException("Spotify token refresh returned no access token");
        }

        Instant now = clock.instant();
        credential.setAccessToken(response.accessToken());
        if (response.refreshToken() != null) {
            credential.setRefreshToken(response.refreshToken());
        }
        credential.setTokenExpiry(now.plusSeconds(response.expiresIn()));
        credential.setUpdatedAt(now);
        credentialRepository.save(credential);
        log.info("Refreshed Spotify token for user {}", credential.getUserId());
        return credential.getAccessToken();
    }

    private PlatformCredential load(String userId) {
        return credentialRepository.findByUserIdAndPlatform(userId, Platform.SPOTIFY)
                .orElseThrow(() -> new CatalogException("User " + userId + " is not connected to Spotify"));
    }

    private String basicCredentials() {
        String pair = config.getClientId() + ":" + config.getClientSecret();
        return Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }
}
