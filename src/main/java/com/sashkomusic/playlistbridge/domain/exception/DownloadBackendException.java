package com.sashkomusic.playlistbridge.domain.exception;

public class DownloadBackendException extends PlaylistTransferException {

    public DownloadBackendException(String message) {
        super(ErrorCode.DOWNLOAD_BACKEND_ERROR, message);
    }

    public DownloadBackendException(String message, Throwable cause) {
        super(ErrorCode.DOWNLOAD_BACKEND_ERROR, message, cause);
    }
}
