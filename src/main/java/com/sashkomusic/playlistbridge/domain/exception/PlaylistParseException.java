package com.sashkomusic.playlistbridge.domain.exception;

public class PlaylistParseException extends PlaylistTransferException {

    public PlaylistParseException(String message) {
        super(ErrorCode.PARSE_ERROR, message);
    }

    public PlaylistParseException(String message, Throwable cause) {
        super(ErrorCode.PARSE_ERROR, message, cause);
    }
}
