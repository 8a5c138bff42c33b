package com.sashkomusic.playlistbridge.domain.model;

/**
 * A reviewer's choice for the song at {@code position} (0-based, original playlist order).
 * A {@code null} selection declines the song.
 */
public record ReviewDecision(
        int position,
        SelectedMatch selection
) {

    public static ReviewDecision accept(int position, Platform platform, String platformId) {
        return new ReviewDecision(position, new SelectedMatch(platform, platformId));
    }

    public static ReviewDecision decline(int position) {
        return new ReviewDecision(position, null);
    }
}
