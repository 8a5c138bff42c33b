package com.sashkomusic.playlistbridge.domain.service.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sashkomusic.playlistbridge.domain.exception.PlaylistParseException;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;
import com.sashkomusic.playlistbridge.domain.model.Song;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Structured JSON playlists. Writes the {@code aidj-playlist} envelope and reads it back, plus
 * Spotify and YouTube playlist dumps, bare arrays of songs or {@code "Artist - Title"} strings,
 * and objects with a {@code songs} array.
 */
@Component
@RequiredArgsConstructor
public class JsonFormatHandler implements PlaylistFormatHandler {

    static final String ENVELOPE_FORMAT = "aidj-playlist";
    static final String ENVELOPE_VERSION = "1.0";

    private final ObjectMapper objectMapper;

    @Override
    public PlaylistFormat format() {
        return PlaylistFormat.JSON;
    }

    @Override
    public ParsedPlaylist parse(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new PlaylistParseException("Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new PlaylistParseException("Failed to parse JSON: document is empty");
        }

        List<String> warnings = new ArrayList<>();
        Playlist playlist;
        if (root.isObject() && ENVELOPE_FORMAT.equals(root.path("format").asText()) && root.path("playlist").isObject()) {
            playlist = parseEnvelope(root.path("playlist"), warnings);
        } else if (root.isObject() && (root.has("tracks") || root.has("items"))) {
            playlist = parseSpotify(root, warnings);
        } else if (root.isObject() && (root.has("playlistItems") || root.has("videoIds"))) {
            playlist = parseYoutube(root, warnings);
        } else if (root.isArray()) {
            playlist = new Playlist(Playlist.DEFAULT_NAME, null, null, null, null, parseGenericSongs(root, warnings));
        } else if (root.isObject() && root.path("songs").isArray()) {
            String name = firstText(root, "name", "playlistName");
            playlist = new Playlist(name != null ? name : Playlist.DEFAULT_NAME, text(root, "description"), null, null, null,
                    parseGenericSongs(root.path("songs"), warnings));
        } else {
            throw new PlaylistParseException(
                    "Unrecognized JSON format. Expected array of songs or object with songs/tracks array.");
        }
        return new ParsedPlaylist(playlist, PlaylistFormat.JSON, warnings);
    }

    @Override
    public String render(Playlist playlist, RenderOptions options, Instant renderedAt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("version", ENVELOPE_VERSION);
        root.put("format", ENVELOPE_FORMAT);
        root.put("exportedAt", renderedAt.toString());

        ObjectNode body = root.putObject("playlist");
        body.put("name", playlist.name());
        putIfPresent(body, "description", playlist.description());
        putIfPresent(body, "creator", playlist.creator());
        if (playlist.platform() != null) {
            body.put("platform", playlist.platform().getValue());
        }
        if (playlist.createdAt() != null) {
            body.put("createdAt", playlist.createdAt().toString());
        }
        body.put("songCount", playlist.songs().size());

        ArrayNode songs = body.putArray("songs");
        int position = 1;
        for (Song song : playlist.songs()) {
            ObjectNode node = songs.addObject();
            node.put("position", position++);
            node.put("title", song.title());
            node.put("artist", song.artist());
            putIfPresent(node, "album", song.album());
            if (song.duration() != null) {
                node.put("duration", song.duration());
            }
            if (song.trackNumber() != null) {
                node.put("track", song.trackNumber());
            }
            if (options.includeMetadata()) {
                putIfPresent(node, "isrc", song.isrc());
                if (song.platform() != null) {
                    node.put("platform", song.platform().getValue());
                }
                putIfPresent(node, "platformId", song.platformId());
            }
            putIfPresent(node, "url", song.url());
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize playlist JSON", e);
        }
    }

    private Playlist parseEnvelope(JsonNode node, List<String> warnings) {
        List<Song> songs = new ArrayList<>();
        int index = 0;
        for (JsonNode item : node.path("songs")) {
            index++;
            String title = text(item, "title");
            if (title == null) {
                warnings.add("Song " + index + ": Missing title");
                continue;
            }
            String artist = text(item, "artist");
            songs.add(new Song(title, artist != null ? artist : Song.UNKNOWN_ARTIST, text(item, "album"),
                    integer(item, "duration"), integer(item, "track"), text(item, "isrc"),
                    platform(item.path("platform").asText(null), warnings), text(item, "platformId"), text(item, "url")));
        }
        String name = text(node, "name");
        return new Playlist(name != null ? name : Playlist.DEFAULT_NAME, text(node, "description"), text(node, "creator"),
                platform(node.path("platform").asText(null), warnings), instant(text(node, "createdAt"), warnings), songs);
    }

    private Playlist parseSpotify(JsonNode root, List<String> warnings) {
        JsonNode tracks = root.path("tracks").path("items");
        if (!tracks.isArray()) {
            tracks = root.path("items").isArray() ? root.path("items") : root.path("tracks");
        }

        List<Song> songs = new ArrayList<>();
        int index = 0;
        for (JsonNode item : tracks) {
            index++;
            JsonNode track = item.has("track") && item.path("track").isObject() ? item.path("track") : item;
            String title = text(track, "name");
            if (title == null) {
                warnings.add("Track " + index + ": Missing track name");
                continue;
            }
            String artist = joinNames(track.path("artists"));
            Integer durationMs = integer(track, "duration_ms");
            songs.add(new Song(title, artist != null ? artist : Song.UNKNOWN_ARTIST, text(track.path("album"), "name"),
                    durationMs != null ? durationMs / 1000 : null, integer(track, "track_number"),
                    text(track.path("external_ids"), "isrc"), Platform.SPOTIFY, text(track, "id"), null));
        }
        String name = text(root, "name");
        return new Playlist(name != null ? name : Playlist.DEFAULT_NAME, text(root, "description"), null,
                Platform.SPOTIFY, null, songs);
    }

    private Playlist parseYoutube(JsonNode root, List<String> warnings) {
        JsonNode items = root.has("playlistItems") ? root.path("playlistItems") : root.path("videoIds");
        List<Song> songs = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items) {
            index++;
            JsonNode snippet = item.path("snippet");
            String title = firstNonNull(text(item, "title"), text(snippet, "title"));
            if (title == null) {
                warnings.add("Item " + index + ": Missing title");
                continue;
            }
            String artist = firstNonNull(text(item, "artist"), text(snippet, "channelTitle"));
            String videoId = firstNonNull(text(item, "videoId"), text(item, "id"));
            songs.add(new Song(title, artist != null ? artist : Song.UNKNOWN_ARTIST, null, null, null, null,
                    Platform.YOUTUBE_MUSIC, videoId, null));
        }
        JsonNode rootSnippet = root.path("snippet");
        String name = firstNonNull(text(root, "title"), text(rootSnippet, "title"));
        return new Playlist(name != null ? name : Playlist.DEFAULT_NAME,
                firstNonNull(text(root, "description"), text(rootSnippet, "description")), null,
                Platform.YOUTUBE_MUSIC, null, songs);
    }

    private List<Song> parseGenericSongs(JsonNode array, List<String> warnings) {
        List<Song> songs = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual()) {
                String value = item.asText().trim();
                int separator = value.indexOf(" - ");
                if (separator > 0) {
                    songs.add(Song.of(value.substring(separator + 3).trim(), value.substring(0, separator).trim()));
                } else if (!value.isEmpty()) {
                    songs.add(Song.of(value, Song.UNKNOWN_ARTIST));
                }
                continue;
            }
            if (!item.isObject()) {
                warnings.add("Skipped unsupported item: " + abbreviate(item.toString()));
                continue;
            }
            String title = firstText(item, "title", "name", "track", "songTitle");
            if (title == null) {
                warnings.add("Skipped item without title: " + abbreviate(item.toString()));
                continue;
            }
            String artist = item.path("artists").isArray() ? joinNames(item.path("artists"))
                    : firstText(item, "artist", "artists", "songArtist");
            songs.add(new Song(title, artist != null ? artist : Song.UNKNOWN_ARTIST, text(item, "album"),
                    integer(item, "duration"), null, text(item, "isrc"), null, null, text(item, "url")));
        }
        return songs;
    }

    private static String joinNames(JsonNode artists) {
        if (!artists.isArray() || artists.isEmpty()) {
            return null;
        }
        String joined = StreamSupport.stream(artists.spliterator(), false)
                .map(artist -> artist.isTextual() ? artist.asText() : artist.path("name").asText(""))
                .filter(name -> !name.isBlank())
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? null : joined;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.asInt();
        }
        if (value.isTextual() && value.asText().trim().matches("\\d+")) {
            return Integer.parseInt(value.asText().trim());
        }
        return null;
    }

    private static Platform platform(String value, List<String> warnings) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Platform.fromValue(value);
        } catch (IllegalArgumentException e) {
            warnings.add("Unknown platform \"" + value + "\"");
            return null;
        }
    }

    private static Instant instant(String value, List<String> warnings) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            warnings.add("Ignoring unparseable createdAt \"" + value + "\"");
            return null;
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null && !value.isBlank()) {
            node.put(field, value);
        }
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    private static String abbreviate(String value) {
        return value.length() > 100 ? value.substring(0, 100) : value;
    }
}
