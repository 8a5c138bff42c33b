package com.sashkomusic.playlistbridge.domain.service.importing;

import com.sashkomusic.playlistbridge.domain.exception.UnsupportedPlatformException;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.port.CatalogAdapter;
import com.sashkomusic.playlistbridge.domain.port.UserCatalogAdapterFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class CatalogAdapterRegistry {

    private final List<CatalogAdapter> sharedAdapters;
    private final List<UserCatalogAdapterFactory> userAdapterFactories;

    /**
     * Catalogs to search when importing into a playlist on {@code target}.
     * Local playlists are resolved against the media server catalog.
     */
    public List<CatalogAdapter> adaptersFor(String userId, Platform target) {
        Platform platform = target == Platform.LOCAL ? Platform.NAVIDROME : target;

        List<CatalogAdapter> adapters = new ArrayList<>();
        sharedAdapters.stream()
                .filter(adapter -> adapter.platform() == platform)
                .forEach(adapters::add);
        userAdapterFactories.stream()
                .filter(factory -> factory.platform() == platform)
                .map(factory -> factory.forUser(userId))
                .forEach(adapters::add);

        if (adapters.isEmpty()) {
            throw new UnsupportedPlatformException("No catalog available for platform " + target.getValue());
        }
        return adapters;
    }

    public Optional<CatalogAdapter> localCatalog() {
        return sharedAdapters.stream()
                .filter(adapter -> adapter.platform() == Platform.NAVIDROME)
                .findFirst();
    }
}
