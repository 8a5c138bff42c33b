package com.sashkomusic.playlistbridge.web.dto;

import java.util.List;

/**
 * An empty or missing list marks every pending file.
 */
public record MarkOrganizedRequest(List<String> itemIds) {
}
