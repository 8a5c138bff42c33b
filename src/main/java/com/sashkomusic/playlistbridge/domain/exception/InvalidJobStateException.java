package com.sashkomusic.playlistbridge.domain.exception;

public class InvalidJobStateException extends PlaylistTransferException {

    public InvalidJobStateException(String message) {
        super(ErrorCode.INVALID_JOB_STATE, message);
    }
}
