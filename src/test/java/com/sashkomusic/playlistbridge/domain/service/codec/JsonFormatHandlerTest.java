package com.sashkomusic.playlistbridge.domain.service.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.playlistbridge.domain.exception.PlaylistParseException;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonFormatHandlerTest {

    private JsonFormatHandler handler;

    @BeforeEach
    public void setup() {
        handler = new JsonFormatHandler(new ObjectMapper());
    }

    @Test
    public void testParse_SpotifyPlaylistDump() {
        String content = """
                {
                  "name": "Liked",
                  "tracks": {
                    "items": [
                      {"track": {"name": "Get Lucky", "id": "sp1", "duration_ms": 369000, "track_number": 8,
                                 "artists": [{"name": "Daft Punk"}, {"name": "Pharrell Williams"}],
                                 "album": {"name": "Random Access Memories"},
                                 "external_ids": {"isrc": "USQX91300108"}}},
                      {"track": {"id": "sp2"}}
                    ]
                  }
                }
                """;

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().name()).isEqualTo("Liked");
        assertThat(parsed.playlist().platform()).isEqualTo(Platform.SPOTIFY);
        assertThat(parsed.warnings()).containsExactly("Track 2: Missing track name");

        Song song = parsed.playlist().songs().get(0);
        assertThat(song.artist()).isEqualTo("Daft Punk, Pharrell Williams");
        assertThat(song.album()).isEqualTo("Random Access Memories");
        assertThat(song.duration()).isEqualTo(369);
        assertThat(song.trackNumber()).isEqualTo(8);
        assertThat(song.isrc()).isEqualTo("USQX91300108");
        assertThat(song.platformId()).isEqualTo("sp1");
    }

    @Test
    public void testParse_YoutubePlaylistDump() {
        String content = """
                {"snippet": {"title": "Late Night"},
                 "playlistItems": [{"videoId": "dQw4w9WgXcQ", "snippet": {"title": "Nightcall", "channelTitle": "Kavinsky"}}]}
                """;

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().name()).isEqualTo("Late Night");
        Song song = parsed.playlist().songs().get(0);
        assertThat(song.title()).isEqualTo("Nightcall");
        assertThat(song.artist()).isEqualTo("Kavinsky");
        assertThat(song.platform()).isEqualTo(Platform.YOUTUBE_MUSIC);
        assertThat(song.platformId()).isEqualTo("dQw4w9WgXcQ");
    }

    @Test
    public void testParse_GenericSongsObject() {
        String content = """
                {"name": "Mixed", "songs": [
                  {"title": "Teardrop", "artists": ["Massive Attack", "Elizabeth Fraser"], "duration": "330"},
                  {"name": "Angel", "artist": "Massive Attack"},
                  {"foo": 1},
                  42,
                  "Solo Title"
                ]}
                """;

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().name()).isEqualTo("Mixed");
        assertThat(parsed.playlist().songs()).extracting(Song::title).containsExactly("Teardrop", "Angel", "Solo Title");
        assertThat(parsed.playlist().songs().get(0).artist()).isEqualTo("Massive Attack, Elizabeth Fraser");
        assertThat(parsed.playlist().songs().get(0).duration()).isEqualTo(330);
        assertThat(parsed.playlist().songs().get(2).artist()).isEqualTo(Song.UNKNOWN_ARTIST);
        assertThat(parsed.warnings()).hasSize(2);
    }

    @Test
    public void testParse_EnvelopeWithUnknownPlatformWarns() {
        String content = """
                {"version": "1.0", "format": "aidj-playlist",
                 "playlist": {"name": "Env", "createdAt": "yesterday",
                              "songs": [{"title": "A", "artist": "B", "platform": "tidal", "platformId": "9"}]}}
                """;

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().createdAt()).isNull();
        assertThat(parsed.playlist().songs().get(0).platform()).isNull();
        assertThat(parsed.warnings()).containsExactly("Unknown platform \"tidal\"", "Ignoring unparseable createdAt \"yesterday\"");
    }

    @Test
    public void testParse_UnrecognizedShape() {
        assertThatThrownBy(() -> handler.parse("{\"foo\": 1}"))
                .isInstanceOf(PlaylistParseException.class)
                .hasMessageStartingWith("Unrecognized JSON format");
    }
}
