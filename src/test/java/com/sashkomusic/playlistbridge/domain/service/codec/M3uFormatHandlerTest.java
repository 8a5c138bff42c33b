package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class M3uFormatHandlerTest {

    private M3uFormatHandler handler;

    @BeforeEach
    public void setup() {
        handler = new M3uFormatHandler();
    }

    @Test
    public void testParse_ExtendedEntriesAndBareLines() {
        String content = String.join("\n",
                "#EXTM3U",
                "#PLAYLIST:Trip Hop",
                "#EXTINF:215,Radiohead - Karma Police",
                "#EXTALB:OK Computer",
                "/music/Radiohead/OK Computer/Karma Police.mp3",
                "/music/Portishead - Glory Box.flac",
                "#EXTINF:330,Massive Attack - Teardrop",
                "#EXTPID:navidrome:nd-42",
                "teardrop.mp3");

        ParsedPlaylist parsed = handler.parse(content);
        List<Song> songs = parsed.playlist().songs();

        assertThat(parsed.playlist().name()).isEqualTo("Trip Hop");
        assertThat(parsed.warnings()).isEmpty();
        assertThat(songs).extracting(Song::title).containsExactly("Karma Police", "Glory Box", "Teardrop");

        assertThat(songs.get(0).album()).isEqualTo("OK Computer");
        assertThat(songs.get(0).duration()).isEqualTo(215);
        assertThat(songs.get(0).url()).isEqualTo("/music/Radiohead/OK Computer/Karma Police.mp3");

        assertThat(songs.get(1).artist()).isEqualTo("Portishead");
        assertThat(songs.get(1).url()).isEqualTo("/music/Portishead - Glory Box.flac");

        assertThat(songs.get(2).platform()).isEqualTo(Platform.NAVIDROME);
        assertThat(songs.get(2).platformId()).isEqualTo("nd-42");
    }

    @Test
    public void testParse_BadLinesBecomeWarnings() {
        String content = String.join("\n",
                "#EXTM3U",
                "noise without separator",
                "#EXTINF:abc,Broken",
                "#EXTINF:200,Massive Attack - Teardrop",
                "#EXTPID:tidal:999",
                "teardrop.mp3");

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().songs()).extracting(Song::title).containsExactly("Teardrop");
        assertThat(parsed.playlist().songs().get(0).platform()).isNull();
        assertThat(parsed.warnings()).containsExactly(
                "Line 2: Could not parse song info from \"noise without separator\"",
                "Line 3: Could not parse track info from \"#EXTINF:abc,Broken\"",
                "Line 5: Unknown platform \"tidal\"");
    }

    @Test
    public void testParse_ExtinfWithoutArtistSeparator() {
        ParsedPlaylist parsed = handler.parse("#EXTINF:-1,Intro\nintro.mp3\n");

        Song song = parsed.playlist().songs().get(0);
        assertThat(song.artist()).isEqualTo(Song.UNKNOWN_ARTIST);
        assertThat(song.title()).isEqualTo("Intro");
        assertThat(song.duration()).isNull();
        assertThat(parsed.playlist().name()).isEqualTo(Playlist.DEFAULT_NAME);
    }

    @Test
    public void testParse_TrailingExtinfWithoutLocationIsKept() {
        ParsedPlaylist parsed = handler.parse("#EXTM3U\r\n#EXTINF:100,Air - Playground Love\r\n");

        assertThat(parsed.playlist().songs()).hasSize(1);
        assertThat(parsed.playlist().songs().get(0).url()).isNull();
    }

    @Test
    public void testParse_OversizedDurationIsWarnedAndDropped() {
        String content = "#EXTM3U\n#EXTINF:99999999999,Artist A - Song One\none.mp3\nArtist B - Song Two\n";

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().songs()).extracting(Song::title).containsExactly("Song One", "Song Two");
        assertThat(parsed.playlist().songs().get(0).duration()).isNull();
        assertThat(parsed.warnings()).containsExactly("Line 2: Invalid duration \"99999999999\"");
    }

    @Test
    public void testParse_DecimalDurationIsRounded() {
        ParsedPlaylist parsed = handler.parse("#EXTM3U\n#EXTINF:180.5,Massive Attack - Angel\nangel.mp3\n");

        Song song = parsed.playlist().songs().get(0);
        assertThat(song.artist()).isEqualTo("Massive Attack");
        assertThat(song.title()).isEqualTo("Angel");
        assertThat(song.duration()).isEqualTo(181);
        assertThat(parsed.warnings()).isEmpty();
    }
}
