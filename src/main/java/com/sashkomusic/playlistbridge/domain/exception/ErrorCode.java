package com.sashkomusic.playlistbridge.domain.exception;

public enum ErrorCode {
    EMPTY_PLAYLIST,
    PARSE_ERROR,
    UNSUPPORTED_FORMAT,
    UNSUPPORTED_PLATFORM,
    DUPLICATE_PLAYLIST_NAME,
    JOB_NOT_FOUND,
    PLAYLIST_NOT_FOUND,
    INVALID_JOB_STATE,
    INVALID_REVIEW,
    CATALOG_ERROR,
    DOWNLOAD_BACKEND_ERROR,
    EXPORT_NOT_READY
}
