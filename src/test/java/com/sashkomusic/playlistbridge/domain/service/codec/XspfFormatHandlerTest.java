package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.exception.PlaylistParseException;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class XspfFormatHandlerTest {

    private XspfFormatHandler handler;

    @BeforeEach
    public void setup() {
        handler = new XspfFormatHandler();
    }

    @Test
    public void testParse_ToleratesIncompleteTracks() {
        String content = """
                <?xml version="1.0" encoding="UTF-8"?>
                <playlist version="1" xmlns="http://xspf.org/ns/0/">
                  <title>Ambient</title>
                  <trackList>
                    <track><title>Avril 14th</title><creator>Aphex Twin</creator><duration>125000</duration></track>
                    <track><title>No creator here</title></track>
                    <track><title>An Ending</title><creator>Brian Eno</creator><duration>about four minutes</duration></track>
                  </trackList>
                </playlist>
                """;

        ParsedPlaylist parsed = handler.parse(content);

        assertThat(parsed.playlist().name()).isEqualTo("Ambient");
        assertThat(parsed.playlist().songs()).extracting(Song::title).containsExactly("Avril 14th", "An Ending");
        assertThat(parsed.playlist().songs().get(0).duration()).isEqualTo(125);
        assertThat(parsed.playlist().songs().get(1).duration()).isNull();
        assertThat(parsed.warnings()).containsExactly(
                "Track 2: Missing required title or artist",
                "Track 3: Invalid duration \"about four minutes\"");
    }

    @Test
    public void testParse_ForeignExtensionsIgnored() {
        String content = """
                <playlist version="1" xmlns="http://xspf.org/ns/0/">
                  <trackList>
                    <track>
                      <title>Xtal</title><creator>Aphex Twin</creator>
                      <extension application="http://example.org/other"><isrc>IGNORED</isrc></extension>
                    </track>
                  </trackList>
                </playlist>
                """;

        Song song = handler.parse(content).playlist().songs().get(0);

        assertThat(song.isrc()).isNull();
        assertThat(song.platform()).isNull();
    }

    @Test
    public void testParse_WrongRootElement() {
        assertThatThrownBy(() -> handler.parse("<rss version=\"2.0\"></rss>"))
                .isInstanceOf(PlaylistParseException.class)
                .hasMessageContaining("<rss>");
    }

    @Test
    public void testParse_DoctypeRejected() {
        String content = "<?xml version=\"1.0\"?><!DOCTYPE playlist [<!ENTITY x \"boom\">]><playlist><title>&x;</title></playlist>";

        assertThatThrownBy(() -> handler.parse(content))
                .isInstanceOf(PlaylistParseException.class);
    }
}
