package com.sashkomusic.playlistbridge.domain.exception;

public class PlaylistTransferException extends RuntimeException {

    private final ErrorCode code;

    public PlaylistTransferException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public PlaylistTransferException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
