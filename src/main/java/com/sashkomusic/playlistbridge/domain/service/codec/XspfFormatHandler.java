package com.sashkomusic.playlistbridge.domain.service.codec;

import com.sashkomusic.playlistbridge.domain.exception.PlaylistParseException;
import com.sashkomusic.playlistbridge.domain.model.ParsedPlaylist;
import com.sashkomusic.playlistbridge.domain.model.Platform;
import com.sashkomusic.playlistbridge.domain.model.Playlist;
import com.sashkomusic.playlistbridge.domain.model.PlaylistFormat;
import com.sashkomusic.playlistbridge.domain.model.RenderOptions;
import com.sashkomusic.playlistbridge.domain.model.Song;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * XML Shareable Playlist Format, version 1. Durations are milliseconds on the wire.
 * ISRC and platform ids travel in an {@code <extension>} block.
 */
@Component
public class XspfFormatHandler implements PlaylistFormatHandler {

    static final String NAMESPACE = "http://xspf.org/ns/0/";
    static final String EXTENSION_APPLICATION = "http://aidj.app/xspf";

    @Override
    public PlaylistFormat format() {
        return PlaylistFormat.XSPF;
    }

    @Override
    public ParsedPlaylist parse(String content) {
        Document document = readDocument(content);
        Element root = document.getDocumentElement();
        if (!"playlist".equals(localName(root))) {
            throw new PlaylistParseException("XSPF root element must be <playlist>, found <" + localName(root) + ">");
        }

        List<String> warnings = new ArrayList<>();
        List<Song> songs = new ArrayList<>();

        Element trackList = firstChild(root, "trackList");
        if (trackList != null) {
            List<Element> tracks = children(trackList, "track");
            for (int i = 0; i < tracks.size(); i++) {
                Song song = parseTrack(tracks.get(i), i + 1, warnings);
                if (song != null) {
                    songs.add(song);
                }
            }
        }

        String title = childText(root, "title");
        Playlist playlist = new Playlist(
                title != null && !title.isBlank() ? title : Playlist.DEFAULT_NAME,
                childText(root, "annotation"),
                childText(root, "creator"),
                null,
                parseDate(childText(root, "date"), warnings),
                songs);
        return new ParsedPlaylist(playlist, PlaylistFormat.XSPF, warnings);
    }

    @Override
    public String render(Playlist playlist, RenderOptions options, Instant renderedAt) {
        Document document = newBuilder().newDocument();
        document.setXmlStandalone(true);

        Element root = document.createElementNS(NAMESPACE, "playlist");
        root.setAttribute("version", "1");
        document.appendChild(root);

        appendText(root, "title", playlist.name());
        appendText(root, "annotation", playlist.description());
        appendText(root, "creator", playlist.creator());
        if (playlist.createdAt() != null) {
            appendText(root, "date", playlist.createdAt().toString());
        }

        Element trackList = append(root, "trackList");
        for (Song song : playlist.songs()) {
            Element track = append(trackList, "track");
            appendText(track, "title", song.title());
            appendText(track, "creator", song.artist());
            appendText(track, "album", song.album());
            if (song.duration() != null && song.duration() > 0) {
                appendText(track, "duration", String.valueOf(song.duration() * 1000L));
            }
            if (song.trackNumber() != null) {
                appendText(track, "trackNum", String.valueOf(song.trackNumber()));
            }
            appendText(track, "location", song.url());

            boolean hasPlatformId = song.platform() != null && song.platformId() != null;
            if (options.includeMetadata() && (song.hasIsrc() || hasPlatformId)) {
                Element extension = append(track, "extension");
                extension.setAttribute("application", EXTENSION_APPLICATION);
                if (song.hasIsrc()) {
                    appendText(extension, "isrc", song.isrc());
                }
                if (hasPlatformId) {
                    Element platformId = appendText(extension, "platformId", song.platformId());
                    if (platformId != null) {
                        platformId.setAttribute("platform", song.platform().getValue());
                    }
                }
            }
        }
        return write(document);
    }

    private Song parseTrack(Element track, int position, List<String> warnings) {
        String title = childText(track, "title");
        String artist = childText(track, "creator");
        if (title == null || title.isBlank() || artist == null || artist.isBlank()) {
            warnings.add("Track " + position + ": Missing required title or artist");
            return null;
        }

        Integer duration = null;
        String durationText = childText(track, "duration");
        if (durationText != null) {
            try {
                duration = (int) (Long.parseLong(durationText.trim()) / 1000);
            } catch (NumberFormatException e) {
                warnings.add("Track " + position + ": Invalid duration \"" + durationText + "\"");
            }
        }
        Integer trackNumber = null;
        String trackNumText = childText(track, "trackNum");
        if (trackNumText != null) {
            try {
                trackNumber = Integer.parseInt(trackNumText.trim());
            } catch (NumberFormatException e) {
                warnings.add("Track " + position + ": Invalid track number \"" + trackNumText + "\"");
            }
        }

        String isrc = null;
        Platform platform = null;
        String platformId = null;
        for (Element extension : children(track, "extension")) {
            if (!EXTENSION_APPLICATION.equals(extension.getAttribute("application"))) {
                continue;
            }
            isrc = childText(extension, "isrc");
            Element platformIdElement = firstChild(extension, "platformId");
            if (platformIdElement != null) {
                try {
                    platform = Platform.fromValue(platformIdElement.getAttribute("platform"));
                    platformId = platformIdElement.getTextContent().trim();
                } catch (IllegalArgumentException e) {
                    warnings.add("Track " + position + ": Unknown platform \""
                            + platformIdElement.getAttribute("platform") + "\"");
                }
            }
        }

        return new Song(title.trim(), artist.trim(), childText(track, "album"), duration, trackNumber,
                isrc, platform, platformId, childText(track, "location"));
    }

    private Instant parseDate(String value, List<String> warnings) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            warnings.add("Ignoring unparseable playlist date \"" + value + "\"");
            return null;
        }
    }

    private Document readDocument(String content) {
        try {
            return newBuilder().parse(new InputSource(new StringReader(content.trim())));
        } catch (SAXException | IOException e) {
            throw new PlaylistParseException("Invalid XSPF document: " + e.getMessage(), e);
        }
    }

    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    private String write(Document document) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize XSPF document", e);
        }
    }

    private static Element append(Element parent, String name) {
        Element element = parent.getOwnerDocument().createElementNS(NAMESPACE, name);
        parent.appendChild(element);
        return element;
    }

    private static Element appendText(Element parent, String name, String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Element element = append(parent, name);
        element.setTextContent(text);
        return element;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Element firstChild(Element parent, String name) {
        List<Element> matches = children(parent, name);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static String childText(Element parent, String name) {
        Element child = firstChild(parent, name);
        if (child == null) {
            return null;
        }
        String text = child.getTextContent();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
