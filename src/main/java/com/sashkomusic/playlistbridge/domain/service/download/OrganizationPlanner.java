package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.config.LibraryConfig;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.OrganizationFile;
import com.sashkomusic.playlistbridge.domain.model.PendingOrganization;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Suggests where fetched files belong in the library:
 * {@code <root>/<artist>/<album or singles folder>/<artist> - <title>.<ext>}.
 * Nothing is moved; the suggestions are recorded for whoever organizes the files.
 * With {@code library.organization.enabled} off, files are still listed but carry no suggestion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizationPlanner {

    private static final int MAX_FOLDER_NAME_LENGTH = 200;
    private static final String DEFAULT_EXTENSION = "mp3";

    private final LibraryConfig libraryConfig;

    /**
     * Rebuilds the pending-organization record from the current queue, keeping
     * the organized flag of files that were already handled.
     */
    public PendingOrganization plan(List<DownloadQueueItem> queue, PendingOrganization previous) {
        Map<String, OrganizationFile> known = previous == null ? Map.of() : previous.files().stream()
                .collect(Collectors.toMap(OrganizationFile::itemId, Function.identity(), (a, b) -> a));

        List<OrganizationFile> files = new ArrayList<>();
        for (DownloadQueueItem item : queue) {
            OrganizationFile existing = known.get(item.id());
            if (existing != null && existing.organized()) {
                files.add(existing);
                continue;
            }
            if (item.needsManualOrganization() && item.status() == DownloadItemStatus.COMPLETED
                    && item.downloadedPath() != null) {
                String suggested = libraryConfig.getOrganization().isEnabled() ? suggestPath(item) : null;
                files.add(new OrganizationFile(item.id(), item.downloadedPath(), suggested,
                        item.title(), item.artist(), false));
            }
        }

        if (files.isEmpty()) {
            return null;
        }
        boolean allOrganized = files.stream().allMatch(OrganizationFile::organized);
        return new PendingOrganization(files, allOrganized);
    }

    public String suggestPath(DownloadQueueItem item) {
        String artistFolder = sanitizeFolderName(item.artist());
        String albumFolder = item.album() != null && !item.album().isBlank()
                ? sanitizeFolderName(item.album())
                : libraryConfig.getOrganization().getSinglesFolder();

        String fileName = sanitizeFolderName(item.artist() + " - " + item.title()) + "." + extension(item.downloadedPath());

        Path target = Paths.get(libraryConfig.getRootPath())
                .resolve(artistFolder)
                .resolve(albumFolder)
                .resolve(fileName);
        log.debug("Suggested library path for item {}: {}", item.id(), target);
        return target.toString();
    }

    private String extension(String path) {
        if (path == null) {
            return DEFAULT_EXTENSION;
        }
        String fileName = Paths.get(path).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase() : DEFAULT_EXTENSION;
    }

    private String sanitizeFolderName(String name) {
        if (name == null) {
            return "Unknown";
        }

        String sanitized = name.replaceAll("[/\\\\:*?\"<>|]", "").trim();

        if (sanitized.length() > MAX_FOLDER_NAME_LENGTH) {
            sanitized = sanitized.substring(0, MAX_FOLDER_NAME_LENGTH).trim();
        }

        return sanitized.isEmpty() ? "Unknown" : sanitized;
    }
}
