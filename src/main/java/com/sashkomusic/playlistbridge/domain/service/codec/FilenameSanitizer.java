package com.sashkomusic.playlistbridge.domain.service.codec;

import java.util.regex.Pattern;

public final class FilenameSanitizer {

    private static final Pattern RESERVED = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_UNDERSCORE = Pattern.compile("_+");
    private static final int MAX_LENGTH = 200;

    private FilenameSanitizer() {
    }

    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "playlist";
        }
        String result = RESERVED.matcher(name).replaceAll("_");
        result = WHITESPACE.matcher(result).replaceAll("_");
        result = REPEATED_UNDERSCORE.matcher(result).replaceAll("_");
        return result.length() > MAX_LENGTH ? result.substring(0, MAX_LENGTH) : result;
    }

    /**
     * Replaces only characters that are illegal in file names, keeping spaces.
     * Used for paths inside rendered playlists and organization suggestions.
     */
    public static String sanitizePathSegment(String name) {
        if (name == null || name.isBlank()) {
            return "_";
        }
        return RESERVED.matcher(name.trim()).replaceAll("_");
    }
}
