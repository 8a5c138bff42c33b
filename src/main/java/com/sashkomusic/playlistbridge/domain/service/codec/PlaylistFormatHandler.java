package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;

import java.time.Instant;

/**
 * Reads and writes one playlist file format.
 * <p>
 * Parsing is tolerant: entries that cannot be understood become warnings on the returned
 * {@link ParsedPlaylist}. Only input that is unreadable as a whole raises
 * {@link com.sashkomusic.playlistbridge.domain.exception.PlaylistParseException}.
 * An empty song list is returned as is; the caller decides whether that is an error.
 */
public interface PlaylistFormatHandler {

    PlaylistFormat format();

    ParsedPlaylist parse(String content);

    String render(Playlist playlist, RenderOptions options, Instant renderedAt);
}
