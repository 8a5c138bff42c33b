package com.sashkomusic.playlistbridge.domain.exception;

public class ExportNotReadyException extends PlaylistTransferException {

    public ExportNotReadyException(String message) {
        super(ErrorCode.EXPORT_NOT_READY, message);
    }
}
