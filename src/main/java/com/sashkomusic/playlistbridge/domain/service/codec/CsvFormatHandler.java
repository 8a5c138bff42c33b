package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.exception.PlaylistParseException;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Spreadsheet exports (Exportify, TuneMyMusic, Soundiiz and our own). Headers are matched
 * case-insensitively against the known aliases of each canonical column.
 */
@Component
public class CsvFormatHandler implements PlaylistFormatHandler {

    static final List<String> TITLE_COLUMNS = List.of("title", "track name", "track", "name", "song", "song name");
    static final List<String> ARTIST_COLUMNS = List.of("artist", "artist name(s)", "artist name", "artists", "artist(s)");
    static final List<String> ALBUM_COLUMNS = List.of("album", "album name");
    static final List<String> DURATION_SECONDS_COLUMNS = List.of("duration", "duration (s)", "length");
    static final List<String> DURATION_MS_COLUMNS = List.of("duration (ms)", "duration_ms", "track duration (ms)");
    static final List<String> ISRC_COLUMNS = List.of("isrc");
    static final List<String> PLATFORM_COLUMNS = List.of("platform");
    static final List<String> PLATFORM_ID_COLUMNS = List.of("platform id", "platformid", "track id", "spotify id");
    static final List<String> URL_COLUMNS = List.of("url", "location", "track uri", "spotify uri");

    private static final String[] HEADER = {"Title", "Artist", "Album", "Duration", "ISRC", "Platform", "Platform ID", "URL"};

    @Override
    public PlaylistFormat format() {
        return PlaylistFormat.CSV;
    }

    /**
     * True when a header line names both a title-like and an artist-like column.
     */
    public static boolean looksLikeHeader(String firstLine) {
        Map<String, Integer> columns = indexColumns(List.of(firstLine.split(",")));
        return findColumn(columns, TITLE_COLUMNS) >= 0 && findColumn(columns, ARTIST_COLUMNS) >= 0;
    }

    @Override
    public ParsedPlaylist parse(String content) {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .setAllowMissingColumnNames(true)
                .build();

        List<Song> songs = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        try (CSVParser parser = CSVParser.parse(stripBom(content), csvFormat)) {
            Map<String, Integer> columns = indexColumns(parser.getHeaderNames());
            int title = findColumn(columns, TITLE_COLUMNS);
            int artist = findColumn(columns, ARTIST_COLUMNS);
            if (title < 0) {
                throw new PlaylistParseException("CSV header has no title column. Found: " + parser.getHeaderNames());
            }
            if (artist < 0) {
                warnings.add("CSV header has no artist column, artists will be unknown");
            }
            ColumnLayout layout = new ColumnLayout(title, artist, findColumn(columns, ALBUM_COLUMNS),
                    findColumn(columns, DURATION_SECONDS_COLUMNS), findColumn(columns, DURATION_MS_COLUMNS),
                    findColumn(columns, ISRC_COLUMNS), findColumn(columns, PLATFORM_COLUMNS),
                    findColumn(columns, PLATFORM_ID_COLUMNS), findColumn(columns, URL_COLUMNS));

            Iterator<CSVRecord> records = parser.iterator();
            while (true) {
                CSVRecord record;
                try {
                    if (!records.hasNext()) {
                        break;
                    }
                    record = records.next();
                } catch (UncheckedIOException | IllegalStateException e) {
                    warnings.add("Stopped reading CSV at a malformed row: " + e.getMessage());
                    break;
                }
                Song song = toSong(record, layout, warnings);
                if (song != null) {
                    songs.add(song);
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new PlaylistParseException("Failed to read CSV: " + e.getMessage(), e);
        }

        Playlist playlist = new Playlist(Playlist.DEFAULT_NAME, null, null, null, null, songs);
        return new ParsedPlaylist(playlist, PlaylistFormat.CSV, warnings);
    }

    @Override
    public String render(Playlist playlist, RenderOptions options, Instant renderedAt) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(HEADER).build())) {
            for (Song song : playlist.songs()) {
                boolean metadata = options.includeMetadata();
                printer.printRecord(
                        song.title(),
                        song.artist(),
                        song.album(),
                        song.duration(),
                        metadata ? song.isrc() : null,
                        metadata && song.platform() != null ? song.platform().getValue() : null,
                        metadata ? song.platformId() : null,
                        song.url());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render CSV playlist", e);
        }
        return out.toString();
    }

    private Song toSong(CSVRecord record, ColumnLayout layout, List<String> warnings) {
        long row = record.getRecordNumber() + 1;
        String title = value(record, layout.title());
        if (title == null) {
            warnings.add("Row " + row + ": Missing title");
            return null;
        }
        String artist = value(record, layout.artist());

        Integer duration = null;
        String seconds = value(record, layout.durationSeconds());
        String millis = value(record, layout.durationMillis());
        try {
            if (seconds != null) {
                duration = parseDuration(seconds);
            } else if (millis != null) {
                duration = (int) (Long.parseLong(millis) / 1000);
            }
        } catch (NumberFormatException e) {
            warnings.add("Row " + row + ": Invalid duration");
        }

        Platform platform = null;
        String platformValue = value(record, layout.platform());
        if (platformValue != null) {
            try {
                platform = Platform.fromValue(platformValue);
            } catch (IllegalArgumentException e) {
                warnings.add("Row " + row + ": Unknown platform \"" + platformValue + "\"");
            }
        }

        return new Song(title, artist != null ? artist : Song.UNKNOWN_ARTIST, value(record, layout.album()), duration,
                null, value(record, layout.isrc()), platform, value(record, layout.platformId()), value(record, layout.url()));
    }

    /**
     * Accepts plain seconds and {@code m:ss} / {@code h:mm:ss}.
     */
    private static Integer parseDuration(String value) {
        if (!value.contains(":")) {
            return (int) Double.parseDouble(value);
        }
        int total = 0;
        for (String part : value.split(":")) {
            total = total * 60 + Integer.parseInt(part.trim());
        }
        return total;
    }

    private static String value(CSVRecord record, int index) {
        if (index < 0 || index >= record.size()) {
            return null;
        }
        String value = record.get(index);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Map<String, Integer> indexColumns(List<String> headers) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header != null) {
                columns.putIfAbsent(normalize(header), i);
            }
        }
        return columns;
    }

    private static int findColumn(Map<String, Integer> columns, List<String> aliases) {
        for (String alias : aliases) {
            Integer index = columns.get(alias);
            if (index != null) {
                return index;
            }
        }
        return -1;
    }

    private static String normalize(String header) {
        return stripBom(header).replace("\"", "").trim().toLowerCase(Locale.ROOT);
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    private record ColumnLayout(int title, int artist, int album, int durationSeconds, int durationMillis,
                                int isrc, int platform, int platformId, int url) {
    }
}
