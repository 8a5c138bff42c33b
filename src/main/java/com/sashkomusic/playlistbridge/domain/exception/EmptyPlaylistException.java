package com.sashkomusic.playlistbridge.domain.exception;

public class EmptyPlaylistException extends PlaylistTransferException {

    public EmptyPlaylistException(String message) {
        super(ErrorCode.EMPTY_PLAYLIST, message);
    }
}
