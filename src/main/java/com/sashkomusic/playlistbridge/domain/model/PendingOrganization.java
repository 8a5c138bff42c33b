package com.sashkomusic.playlistbridge.domain.model;

import java.util.List;

public record PendingOrganization(
        List<OrganizationFile> files,
        boolean organized
) {

    public PendingOrganization {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
