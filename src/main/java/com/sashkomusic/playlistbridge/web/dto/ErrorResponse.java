package com.sashkomusic.playlistbridge.web.dto;

public record ErrorResponse(String code, String message) {
}
