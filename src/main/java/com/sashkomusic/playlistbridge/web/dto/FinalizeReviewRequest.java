package com.sashkomusic.playlistbridge.web.dto;

import com.sashkomusic.playlistbridge.domain.model.ReviewDecision;

import java.util.List;

public record FinalizeReviewRequest(List<ReviewDecision> decisions) {

    public List<ReviewDecision> decisionsOrEmpty() {
        return decisions == null ? List.of() : decisions;
    }
}
