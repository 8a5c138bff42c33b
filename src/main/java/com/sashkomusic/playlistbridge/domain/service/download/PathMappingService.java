package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.config.PathMappingConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates paths reported by the single-track fetcher (as seen inside its container)
 * into paths visible to this service.
 */
@Service
@RequiredArgsConstructor
public class PathMappingService {

    private final PathMappingConfig pathMappingConfig;

    public String mapFetcherPath(String originalPath) {
        if (!pathMappingConfig.isEnabled() || originalPath == null) {
            return originalPath;
        }

        String source = pathMappingConfig.getFetcherSource();
        String target = pathMappingConfig.getTarget();

        if (source == null || target == null || source.isEmpty() || target.isEmpty()) {
            return originalPath;
        }

        if (originalPath.startsWith(source)) {
            return originalPath.replaceFirst(Pattern.quote(source), Matcher.quoteReplacement(target));
        }

        return originalPath;
    }
}
