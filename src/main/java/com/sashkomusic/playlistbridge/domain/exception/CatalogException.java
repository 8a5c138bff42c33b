package com.sashkomusic.playlistbridge.domain.exception;

public class CatalogException extends PlaylistTransferException {

    public CatalogException(String message) {
        super(ErrorCode.CATALOG_ERROR, message);
    }

    public CatalogException(String message, Throwable cause) {
        super(ErrorCode.CATALOG_ERROR, message, cause);
    }
}
