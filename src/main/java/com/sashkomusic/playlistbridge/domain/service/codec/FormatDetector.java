package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Component
public class FormatDetector {

    /**
     * Filename extension wins. Otherwise the leading content decides; as a last resort,
     * plain text with {@code Artist - Title} lines is treated as M3U.
     */
    public Optional<PlaylistFormat> detect(String content, String filenameHint) {
        Optional<PlaylistFormat> fromFilename = fromFilename(filenameHint);
        if (fromFilename.isPresent()) {
            log.debug("Detected format {} from filename {}", fromFilename.get(), filenameHint);
            return fromFilename;
        }
        return fromContent(content);
    }

    Optional<PlaylistFormat> fromFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        String lower = filename.trim().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".m3u") || lower.endsWith(".m3u8")) {
            return Optional.of(PlaylistFormat.M3U);
        }
        if (lower.endsWith(".xspf") || lower.endsWith(".xml")) {
            return Optional.of(PlaylistFormat.XSPF);
        }
        if (lower.endsWith(".json")) {
            return Optional.of(PlaylistFormat.JSON);
        }
        if (lower.endsWith(".csv")) {
            return Optional.of(PlaylistFormat.CSV);
        }
        return Optional.empty();
    }

    Optional<PlaylistFormat> fromContent(String content) {
        if (content == null) {
            return Optional.empty();
        }
        String trimmed = content.replace("\uFEFF", "").trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (trimmed.startsWith("#")) {
            return Optional.of(PlaylistFormat.M3U);
        }
        if (trimmed.startsWith("<?xml") || trimmed.startsWith("<playlist")) {
            return Optional.of(PlaylistFormat.XSPF);
        }
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return Optional.of(PlaylistFormat.JSON);
        }

        String firstLine = trimmed.lines().findFirst().orElse("");
        if (firstLine.contains(",") && CsvFormatHandler.looksLikeHeader(firstLine)) {
            return Optional.of(PlaylistFormat.CSV);
        }
        boolean artistTitleLines = Arrays.stream(trimmed.split("\\r?\\n"))
                .map(String::trim)
                .anyMatch(line -> line.indexOf(" - ") > 0);
        if (artistTitleLines) {
            return Optional.of(PlaylistFormat.M3U);
        }
        return Optional.empty();
    }
}
