package com.sashkomusic.playlistbridge.infrastructure.client.navidrome;

import java.time.Duration;
import java.time.Instant;

/**
 * Credentials returned by the Navidrome login endpoint. The native API uses {@code token}
 * and {@code clientId}; the Subsonic API uses the salted token pair.
 */
public record NavidromeSession(
        String token,
        String clientId,
        String subsonicToken,
        String subsonicSalt,
        Instant expiresAt
) {

    public boolean isUsableAt(Instant now, Duration refreshMargin) {
        return now.isBefore(expiresAt.minus(refreshMargin));
    }
}
