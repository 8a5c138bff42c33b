package com.sashkomusic.playlistbridge.domain.model;

import java.util.List;

public class ValidationResult {
    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;
    private final PlaylistFormat format;
    private final String playlistName;
    private final int songCount;

    private ValidationResult(boolean valid, List<String> errors, List<String> warnings,
                             PlaylistFormat format, String playlistName, int songCount) {
        this.valid = valid;
        this.errors = errors;
        this.warnings = warnings;
        this.format = format;
        this.playlistName = playlistName;
        this.songCount = songCount;
    }

    public static ValidationResult valid(ParsedPlaylist parsed, List<String> warnings) {
        return new ValidationResult(true, List.of(), List.copyOf(warnings), parsed.format(),
                parsed.playlist().name(), parsed.playlist().songs().size());
    }

    public static ValidationResult invalid(List<String> errors, List<String> warnings, PlaylistFormat format, int songCount) {
        return new ValidationResult(false, List.copyOf(errors), List.copyOf(warnings), format, null, songCount);
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public PlaylistFormat getFormat() {
        return format;
    }

    public String getPlaylistName() {
        return playlistName;
    }

    public int getSongCount() {
        return songCount;
    }

    public String getErrorMessage() {
        return String.join("; ", errors);
    }
}
