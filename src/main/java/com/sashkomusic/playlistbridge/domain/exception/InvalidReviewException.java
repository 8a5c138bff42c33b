package com.sashkomusic.playlistbridge.domain.exception;

public class InvalidReviewException extends PlaylistTransferException {

    public InvalidReviewException(String message) {
        super(ErrorCode.INVALID_REVIEW, message);
    }
}
