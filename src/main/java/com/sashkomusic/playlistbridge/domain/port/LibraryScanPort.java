package com.sashkomusic.playlistbridge.domain.port;

/**
 * Asks the media server to pick up files that were moved into the library.
 */
public interface LibraryScanPort {

    /**
     * Best effort; failures are logged, never thrown.
     *
     * @param folderPath folder to rescan, or {@code null} for the whole library
     */
    void triggerScan(String folderPath);
}
