package com.sashkomusic.playlistbridge.domain.exception;

public class DuplicatePlaylistNameException extends PlaylistTransferException {

    public DuplicatePlaylistNameException(String message) {
        super(ErrorCode.DUPLICATE_PLAYLIST_NAME, message);
    }
}
