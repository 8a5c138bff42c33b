package com.sashkomusic.playlistbridge.domain.exception;

public class JobNotFoundException extends PlaylistTransferException {

    public JobNotFoundException(String message) {
        super(ErrorCode.JOB_NOT_FOUND, message);
    }
}
