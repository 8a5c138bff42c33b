package com.sashkomusic.playlistbridge.domain.exception;

public class PlaylistNotFoundException extends PlaylistTransferException {

    public PlaylistNotFoundException(String message) {
        super(ErrorCode.PLAYLIST_NOT_FOUND, message);
    }
}
