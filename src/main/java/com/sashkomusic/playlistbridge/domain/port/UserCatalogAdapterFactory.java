package com.sashkomusic.playlistbridge.domain.port;

import com.sashkomusic.playlistbridge.domain.model.Platform;

/**
 * Creates catalog adapters bound to one user's platform credential.
 */
public interface UserCatalogAdapterFactory {

    Platform platform();

    CatalogAdapter forUser(String userId);
}
