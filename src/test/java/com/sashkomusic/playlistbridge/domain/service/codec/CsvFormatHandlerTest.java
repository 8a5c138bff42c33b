package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.exception.PlaylistParseException;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CsvFormatHandlerTest {

    private CsvFormatHandler handler;

    @BeforeEach
    public void setup() {
        handler = new CsvFormatHandler();
    }

    @Test
    public void testParse_ExportifyColumns() {
        String content = "\"Track URI\",\"Track Name\",\"Artist Name(s)\",\"Album Name\",\"Duration (ms)\",\"ISRC\"\n"
                + "\"spotify:track:1\",\"Teardrop\",\"Massive Attack\",\"Mezzanine\",\"330773\",\"GBAAA9800300\"\n"
                + "\"spotify:track:2\",\"\",\"Nobody\",\"Nothing\",\"1000\",\"\"\n";

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().songs()).hasSize(1);
        Song song = parsed.playlist().songs().get(0);
        assertThat(song.title()).isEqualTo("Teardrop");
        assertThat(song.artist()).isEqualTo("Massive Attack");
        assertThat(song.album()).isEqualTo("Mezzanine");
        assertThat(song.duration()).isEqualTo(330);
        assertThat(song.isrc()).isEqualTo("GBAAA9800300");
        assertThat(song.url()).isEqualTo("spotify:track:1");
        assertThat(parsed.warnings()).hasSize(1);
        assertThat(parsed.warnings().get(0)).contains("Missing title");
    }

    @Test
    public void testParse_ClockDurationsAndMissingArtistColumn() {
        ParsedPlaylist parsed = handler.parse("Song,Length\nWindowlicker,6:07\nLong One,1:02:03\n");

        assertThat(parsed.playlist().songs()).extracting(Song::duration).containsExactly(367, 3723);
        assertThat(parsed.playlist().songs()).extracting(Song::artist).containsOnly(Song.UNKNOWN_ARTIST);
        assertThat(parsed.warnings()).containsExactly("CSV header has no artist column, artists will be unknown");
    }

    @Test
    public void testParse_InvalidValuesAreWarnings() {
        ParsedPlaylist parsed = handler.parse("Title,Artist,Duration,Platform\nA,B,soon,napster\n");

        Song song = parsed.playlist().songs().get(0);
        assertThat(song.duration()).isNull();
        assertThat(song.platform()).isNull();
        assertThat(parsed.warnings()).hasSize(2);
    }

    @Test
    public void testParse_NoTitleColumn() {
        assertThatThrownBy(() -> handler.parse("Artist,Album\nAir,Moon Safari\n"))
                .isInstanceOf(PlaylistParseException.class)
                .hasMessageContaining("no title column");
    }

    @Test
    public void testLooksLikeHeader() {
        assertThat(CsvFormatHandler.looksLikeHeader("Title,Artist,Album")).isTrue();
        assertThat(CsvFormatHandler.looksLikeHeader("\"Track Name\",\"Artist Name(s)\"")).isTrue();
        assertThat(CsvFormatHandler.looksLikeHeader("Teardrop,Massive Attack")).isFalse();
    }
}
