package com.sashkomusic.playlistbridge.domain.service.download;

import com.sashkomusic.playlistbridge.config.LibraryConfig;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.model.DownloadQueueItem;
import com.sashkomusic.playlistbridge.domain.model.DownloadService;
import com.sashkomusic.playlistbridge.domain.model.OrganizationFile;
import com.sashkomusic.playlistbridge.domain.model.PendingOrganization;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class OrganizationPlannerTest {

    private LibraryConfig libraryConfig;
    private OrganizationPlanner planner;

    @BeforeEach
    public void setup() {
        libraryConfig = new LibraryConfig();
        libraryConfig.setRootPath("/music");
        planner = new OrganizationPlanner(libraryConfig);
    }

    @Test
    public void testSuggestPath() {
        DownloadQueueItem withAlbum = fetched("a", "Teardrop", "Massive Attack", "Mezzanine", "/dl/teardrop.OPUS");
        DownloadQueueItem single = fetched("b", "Who: Me?", "AC/DC", null, "/dl/noext");

        assertThat(planner.suggestPath(withAlbum))
                .isEqualTo(Paths.get("/music", "Massive Attack", "Mezzanine", "Massive Attack - Teardrop.opus").toString());
        assertThat(planner.suggestPath(single))
                .isEqualTo(Paths.get("/music", "ACDC", "Singles", "ACDC - Who Me.mp3").toString());
    }

    @Test
    public void testPlan_OnlyCompletedFetchedFiles() {
        DownloadQueueItem done = fetched("a", "Teardrop", "Massive Attack", null, "/dl/teardrop.mp3");
        DownloadQueueItem running = done.toBuilder().id("b").status(DownloadItemStatus.DOWNLOADING).build();
        DownloadQueueItem imported = done.toBuilder().id("c").service(DownloadService.CATALOG_MANAGER)
                .needsManualOrganization(false).build();

        PendingOrganization plan = planner.plan(List.of(done, running, imported), null);

        assertThat(plan.organized()).isFalse();
        assertThat(plan.files()).extracting(OrganizationFile::itemId).containsExactly("a");
        assertThat(plan.files().get(0).path()).isEqualTo("/dl/teardrop.mp3");
    }

    @Test
    public void testPlan_SuggestionsDisabled() {
        libraryConfig.getOrganization().setEnabled(false);
        DownloadQueueItem done = fetched("a", "Teardrop", "Massive Attack", null, "/dl/teardrop.mp3");

        PendingOrganization plan = planner.plan(List.of(done), null);

        assertThat(plan.files()).singleElement().satisfies(file -> {
            assertThat(file.path()).isEqualTo("/dl/teardrop.mp3");
            assertThat(file.suggestedPath()).isNull();
            assertThat(file.organized()).isFalse();
        });
    }

    @Test
    public void testPlan_KeepsOrganizedFlag() {
        DownloadQueueItem moved = fetched("a", "Teardrop", "Massive Attack", null, "/dl/teardrop.mp3")
                .toBuilder().needsManualOrganization(false).build();
        PendingOrganization previous = new PendingOrganization(List.of(
                new OrganizationFile("a", "/dl/teardrop.mp3", "/music/x.mp3", "Teardrop", "Massive Attack", true)), true);

        PendingOrganization plan = planner.plan(List.of(moved), previous);

        assertThat(plan.organized()).isTrue();
        assertThat(plan.files()).singleElement().extracting(OrganizationFile::organized).isEqualTo(true);
    }

    @Test
    public void testPlan_NothingToOrganize() {
        assertThat(planner.plan(List.of(), null)).isNull();
    }

    private static DownloadQueueItem fetched(String id, String title, String artist, String album, String path) {
        return DownloadQueueItem.builder()
                .id(id)
                .title(title)
                .artist(artist)
                .album(album)
                .service(DownloadService.SINGLE_TRACK_FETCHER)
                .status(DownloadItemStatus.COMPLETED)
                .downloadedPath(path)
                .needsManualOrganization(true)
                .build();
    }
}
