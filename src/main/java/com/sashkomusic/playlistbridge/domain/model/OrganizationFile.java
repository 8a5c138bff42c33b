package com.sashkomusic.playlistbridge.domain.model;

public record OrganizationFile(
        String itemId,
        String path,
        String suggestedPath,
        String title,
        String artist,
        boolean organized
) {

    public OrganizationFile markOrganized() {
        return new OrganizationFile(itemId, path, suggestedPath, title, artist, true);
    }
}
