package com.sashkomusic.playlistbridge.web;

import com.sashkomusic.playlistbridge.domain.exception.PlaylistTransferException;
import com.sashkomusic.playlistbridge.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PlaylistTransferException.class)
    public ResponseEntity<ErrorResponse> handlePlaylistTransferException(PlaylistTransferException exception) {
        HttpStatus status = switch (exception.getCode()) {
            case EMPTY_PLAYLIST, PARSE_ERROR, UNSUPPORTED_FORMAT, UNSUPPORTED_PLATFORM, INVALID_REVIEW -> HttpStatus.BAD_REQUEST;
            case JOB_NOT_FOUND, PLAYLIST_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_PLAYLIST_NAME, INVALID_JOB_STATE, EXPORT_NOT_READY -> HttpStatus.CONFLICT;
            case CATALOG_ERROR, DOWNLOAD_BACKEND_ERROR -> HttpStatus.BAD_GATEWAY;
        };

        if (status.is5xxServerError()) {
            log.warn("Request failed on an upstream service: {}", exception.getMessage());
        } else {
            log.info("Request rejected ({}): {}", exception.getCode(), exception.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(exception.getCode().name(), exception.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception exception) {
        log.info("Bad request: {}", exception.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", exception.getMessage()));
    }
}
