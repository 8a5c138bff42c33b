package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.exception.EmptyPlaylistException;
import com.sashkomusic.playlistbridge.domain.exception.PlaylistTransferException;
import com.sashkomusic.playlistbridge.domain.exception.UnsupportedFormatException;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;
import com.sashkomusic.playlistbridge.domain.model.Song;
import com.sashkomusic.playlistbridge.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for converting between playlist text and {@link Playlist}.
 */
@Slf4j
@Service
public class PlaylistCodec {

    private final Map<PlaylistFormat, PlaylistFormatHandler> handlers = new EnumMap<>(PlaylistFormat.class);
    private final FormatDetector formatDetector;
    private final Clock clock;

    public PlaylistCodec(List<PlaylistFormatHandler> handlers, FormatDetector formatDetector, Clock clock) {
        handlers.forEach(handler -> this.handlers.put(handler.format(), handler));
        this.formatDetector = formatDetector;
        this.clock = clock;
    }

    /**
     * Parses playlist text. An explicit format skips detection.
     *
     * @throws EmptyPlaylistException      when no song can be recovered
     * @throws UnsupportedFormatException  when the format cannot be detected
     */
    public ParsedPlaylist parse(String content, PlaylistFormat format, String filenameHint) {
        if (content == null || content.isBlank()) {
            throw new EmptyPlaylistException("Playlist content is empty");
        }
        PlaylistFormat resolved = format != null ? format : formatDetector.detect(content, filenameHint)
                .orElseThrow(() -> new UnsupportedFormatException("Could not detect playlist format"));

        ParsedPlaylist parsed = handler(resolved).parse(content);
        if (parsed.playlist().songs().isEmpty()) {
            String detail = parsed.warnings().isEmpty() ? "" : " (" + String.join("; ", parsed.warnings()) + ")";
            throw new EmptyPlaylistException("Playlist contains no songs" + detail);
        }
        log.info("Parsed {} playlist '{}': {} songs, {} warnings", resolved, parsed.playlist().name(),
                parsed.playlist().songs().size(), parsed.warnings().size());
        return parsed;
    }

    public String render(Playlist playlist, PlaylistFormat format, RenderOptions options) {
        return handler(format).render(playlist, options != null ? options : RenderOptions.defaults(), clock.instant());
    }

    public ValidationResult validate(String content, PlaylistFormat format, String filenameHint) {
        ParsedPlaylist parsed;
        try {
            parsed = parse(content, format, filenameHint);
        } catch (PlaylistTransferException e) {
            return ValidationResult.invalid(List.of(e.getMessage()), List.of(), format, 0);
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (Playlist.DEFAULT_NAME.equals(parsed.playlist().name())) {
            warnings.add("Playlist name is missing, will use default");
        }
        List<Song> songs = parsed.playlist().songs();
        for (int i = 0; i < songs.size(); i++) {
            Song song = songs.get(i);
            if (song.title() == null || song.title().isBlank()) {
                errors.add("Song " + (i + 1) + ": Missing title");
            }
            if (song.artist() == null || song.artist().isBlank() || Song.UNKNOWN_ARTIST.equals(song.artist())) {
                warnings.add("Song " + (i + 1) + ": Missing artist");
            }
        }
        warnings.addAll(parsed.warnings());

        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors, warnings, parsed.format(), songs.size());
        }
        return ValidationResult.valid(parsed, warnings);
    }

    /**
     * {@code <sanitized name>_<yyyy-MM-dd><ext>}, dated in UTC.
     */
    public String exportFilename(String playlistName, PlaylistFormat format) {
        LocalDate date = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return FilenameSanitizer.sanitize(playlistName) + "_" + date + format.getFileExtension();
    }

    private PlaylistFormatHandler handler(PlaylistFormat format) {
        PlaylistFormatHandler handler = handlers.get(format);
        if (handler == null) {
            throw new UnsupportedFormatException("Unsupported playlist format: " + format);
        }
        return handler;
    }
}
