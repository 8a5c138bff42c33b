package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;
import com.sashkomusic.playlistbridge.domain.model.Song;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extended M3U. Besides {@code #EXTINF} it understands the {@code #PLAYLIST}, {@code #EXTDESC},
 * {@code #EXTCREATOR}, {@code #EXTALB}, {@code #EXTISRC} and {@code #EXTPID:<platform>:<id>} directives.
 * Bare lines without a preceding {@code #EXTINF} are read as {@code Artist - Title},
 * after stripping any directory and extension.
 */
@Slf4j
@Component
public class M3uFormatHandler implements PlaylistFormatHandler {

    private static final Pattern EXTINF = Pattern.compile("#EXTINF:\\s*(-?\\d+(?:\\.\\d+)?)\\s*,(.*)");
    private static final Pattern EXTPID = Pattern.compile("#EXTPID:(\\w+):(.+)");
    private static final String SEPARATOR = " - ";

    @Override
    public PlaylistFormat format() {
        return PlaylistFormat.M3U;
    }

    @Override
    public ParsedPlaylist parse(String content) {
        List<Song> songs = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String name = Playlist.DEFAULT_NAME;
        String description = null;
        String creator = null;
        PendingEntry pending = null;

        String[] lines = content.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = stripBom(lines[i]).trim();
            if (line.isEmpty() || line.startsWith("#EXTM3U")) {
                continue;
            }

            if (line.startsWith("#PLAYLIST:")) {
                name = line.substring("#PLAYLIST:".length()).trim();
            } else if (line.startsWith("#EXTDESC:")) {
                description = line.substring("#EXTDESC:".length()).trim();
            } else if (line.startsWith("#EXTCREATOR:")) {
                creator = line.substring("#EXTCREATOR:".length()).trim();
            } else if (line.startsWith("#EXTINF:")) {
                if (pending != null) {
                    songs.add(pending.toSong(null));
                }
                pending = parseExtinf(line, i + 1, warnings);
                if (pending == null) {
                    warnings.add("Line " + (i + 1) + ": Could not parse track info from \"" + line + "\"");
                }
            } else if (line.startsWith("#EXTALB:")) {
                if (pending != null) {
                    pending.album = line.substring("#EXTALB:".length()).trim();
                }
            } else if (line.startsWith("#EXTISRC:")) {
                if (pending != null) {
                    pending.isrc = line.substring("#EXTISRC:".length()).trim();
                }
            } else if (line.startsWith("#EXTPID:")) {
                if (pending != null) {
                    applyPlatformId(pending, line, i + 1, warnings);
                }
            } else if (line.startsWith("#")) {
                log.debug("Skipping unsupported M3U directive: {}", line);
            } else if (pending != null) {
                songs.add(pending.toSong(line));
                pending = null;
            } else {
                Song song = parseBareLine(line);
                if (song != null) {
                    songs.add(song);
                } else {
                    warnings.add("Line " + (i + 1) + ": Could not parse song info from \"" + line + "\"");
                }
            }
        }
        if (pending != null) {
            songs.add(pending.toSong(null));
        }

        Playlist playlist = new Playlist(name.isEmpty() ? Playlist.DEFAULT_NAME : name,
                description, creator, null, null, songs);
        return new ParsedPlaylist(playlist, PlaylistFormat.M3U, warnings);
    }

    @Override
    public String render(Playlist playlist, RenderOptions options, Instant renderedAt) {
        List<String> lines = new ArrayList<>();
        lines.add("#EXTM3U");
        lines.add("#PLAYLIST:" + playlist.name());
        if (playlist.description() != null && !playlist.description().isBlank()) {
            lines.add("#EXTDESC:" + singleLine(playlist.description()));
        }
        if (playlist.creator() != null && !playlist.creator().isBlank()) {
            lines.add("#EXTCREATOR:" + playlist.creator());
        }

        for (Song song : playlist.songs()) {
            int duration = song.duration() != null && song.duration() > 0 ? song.duration() : -1;
            lines.add("#EXTINF:" + duration + "," + song.artist() + SEPARATOR + song.title());

            if (options.includeMetadata()) {
                if (song.hasAlbum()) {
                    lines.add("#EXTALB:" + song.album());
                }
                if (song.hasIsrc()) {
                    lines.add("#EXTISRC:" + song.isrc());
                }
                if (song.platform() != null && song.platformId() != null) {
                    lines.add("#EXTPID:" + song.platform().getValue() + ":" + song.platformId());
                }
            }
            lines.add(location(song, options));
        }
        return String.join("\n", lines) + "\n";
    }

    private String location(Song song, RenderOptions options) {
        if (song.url() != null && !song.url().isBlank()) {
            return song.url();
        }
        String filename = FilenameSanitizer.sanitizePathSegment(song.artist() + SEPARATOR + song.title()) + ".mp3";
        if (options.basePath() != null && !options.basePath().isBlank()) {
            String base = options.basePath().endsWith("/") ? options.basePath() : options.basePath() + "/";
            return base + filename;
        }
        return filename;
    }

    private PendingEntry parseExtinf(String line, int lineNumber, List<String> warnings) {
        Matcher matcher = EXTINF.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String info = matcher.group(2).trim();
        if (info.isEmpty()) {
            return null;
        }
        PendingEntry entry = new PendingEntry();
        entry.duration = parseDuration(matcher.group(1), lineNumber, warnings);

        int separator = info.indexOf(SEPARATOR);
        if (separator > 0) {
            entry.artist = info.substring(0, separator).trim();
            entry.title = info.substring(separator + SEPARATOR.length()).trim();
        } else {
            entry.artist = Song.UNKNOWN_ARTIST;
            entry.title = info;
        }
        return entry;
    }

    /**
     * Seconds, rounded. Non-positive values mean unknown; values beyond an int are reported and dropped.
     */
    private Integer parseDuration(String value, int lineNumber, List<String> warnings) {
        double seconds;
        try {
            seconds = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            seconds = Double.NaN;
        }
        if (Double.isNaN(seconds) || seconds > Integer.MAX_VALUE) {
            warnings.add("Line " + lineNumber + ": Invalid duration \"" + value + "\"");
            return null;
        }
        long rounded = Math.round(seconds);
        return rounded > 0 ? (int) rounded : null;
    }

    private void applyPlatformId(PendingEntry entry, String line, int lineNumber, List<String> warnings) {
        Matcher matcher = EXTPID.matcher(line);
        if (!matcher.matches()) {
            warnings.add("Line " + lineNumber + ": Malformed platform id \"" + line + "\"");
            return;
        }
        try {
            entry.platform = Platform.fromValue(matcher.group(1));
            entry.platformId = matcher.group(2).trim();
        } catch (IllegalArgumentException e) {
            warnings.add("Line " + lineNumber + ": Unknown platform \"" + matcher.group(1) + "\"");
        }
    }

    private Song parseBareLine(String line) {
        String filename = line;
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (slash >= 0) {
            filename = filename.substring(slash + 1);
        }
        int dot = filename.lastIndexOf('.');
        if (dot > 0 && filename.length() - dot <= 5 && !filename.substring(dot + 1).contains(" ")) {
            filename = filename.substring(0, dot);
        }

        int separator = filename.indexOf(SEPARATOR);
        if (separator <= 0) {
            return null;
        }
        String artist = filename.substring(0, separator).trim();
        String title = filename.substring(separator + SEPARATOR.length()).trim();
        if (title.isEmpty()) {
            return null;
        }
        String url = slash >= 0 || !filename.equals(line) ? line : null;
        return new Song(title, artist, null, null, null, null, null, null, url);
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    private static String singleLine(String text) {
        return text.replaceAll("\\r?\\n", " ");
    }

    private static final class PendingEntry {
        private String title;
        private String artist;
        private Integer duration;
        private String album;
        private String isrc;
        private Platform platform;
        private String platformId;

        private Song toSong(String location) {
            return new Song(title, artist, album, duration, null, isrc, platform, platformId, location);
        }
    }
}
