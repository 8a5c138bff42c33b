package com.sashkomusic.playlistbridge.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DownloadItemStatus {
    @JsonProperty("queued") QUEUED,
    @JsonProperty("downloading") DOWNLOADING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
