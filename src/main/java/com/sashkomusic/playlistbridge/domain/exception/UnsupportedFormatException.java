package com.sashkomusic.playlistbridge.domain.exception;

public class UnsupportedFormatException extends PlaylistTransferException {

    public UnsupportedFormatException(String message) {
        super(ErrorCode.UNSUPPORTED_FORMAT, message);
    }
}
