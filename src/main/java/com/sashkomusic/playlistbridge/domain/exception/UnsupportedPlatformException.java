package com.sashkomusic.playlistbridge.domain.exception;

public class UnsupportedPlatformException extends PlaylistTransferException {

    public UnsupportedPlatformException(String message) {
        super(ErrorCode.UNSUPPORTED_PLATFORM, message);
    }
}
