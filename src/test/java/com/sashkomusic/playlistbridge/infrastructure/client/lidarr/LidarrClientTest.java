package com.sashkomusic.playlistbridge.infrastructure.client.lidarr;

import com.sashkomusic.playlistbridge.config.LidarrConfig;
import com.sashkomusic.playlistbridge.domain.exception.DownloadBackendException;
import com.sashkomusic.playlistbridge.domain.model.BackendQueueEntry;
import com.sashkomusic.playlistbridge.domain.model.DownloadItemStatus;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort.ArtistCandidate;
import com.sashkomusic.playlistbridge.domain.port.CatalogManagerPort.CatalogDownloadRequest;
import com.sashkomusic.playlistbridge.infrastructure.client.lidarr.dto.LidarrQueueRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class LidarrClientTest {

    private static final String BASE_URL = "http://lidarr.local";

    private MockRestServiceServer server;
    private LidarrClient client;

    @BeforeEach
    public void setup() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();

        LidarrConfig config = new LidarrConfig();
        config.setBaseUrl(BASE_URL);
        config.setApiKey("key-1");
        client = new LidarrClient(builder, config);
    }

    @Test
    public void testSearchArtist() {
        server.expect(requestTo(BASE_URL + "/api/v1/artist/lookup?term=Massive%20Attack"))
                .andExpect(header("X-Api-Key", "key-1"))
                .andRespond(withSuccess("""
                        [{"foreignArtistId": "mb-1", "artistName": "Massive Attack", "overview": "Bristol"},
                         {"id": 3, "foreignArtistId": "mb-2", "artistName": "Massive"}]
                        """, MediaType.APPLICATION_JSON));

        List<ArtistCandidate> candidates = client.searchArtist("Massive Attack");

        assertThat(candidates).containsExactly(
                new ArtistCandidate(null, "mb-1", "Massive Attack"),
                new ArtistCandidate(3L, "mb-2", "Massive"));
        assertThat(candidates.get(0).isInLibrary()).isFalse();
    }

    @Test
    public void testEnqueueDownload_NewArtistSingleAlbum() {
        server.expect(requestTo(BASE_URL + "/api/v1/artist"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.foreignArtistId").value("mb-1"))
                .andExpect(jsonPath("$.addOptions.monitor").value("none"))
                .andRespond(withSuccess("{\"id\": 7, \"artistName\": \"Massive Attack\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/api/v1/album?artistId=7"))
                .andRespond(withSuccess("""
                        [{"id": 41, "artistId": 7, "title": "Blue Lines"},
                         {"id": 42, "artistId": 7, "title": "Mezzanine (Deluxe Edition)"}]
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/api/v1/album/monitor"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.albumIds[0]").value(42))
                .andRespond(withSuccess());
        server.expect(requestTo(BASE_URL + "/api/v1/command"))
                .andExpect(jsonPath("$.name").value("AlbumSearch"))
                .andRespond(withSuccess());

        String jobId = client.enqueueDownload(new CatalogDownloadRequest(
                new ArtistCandidate(null, "mb-1", "Massive Attack"), "Mezzanine", false));

        assertThat(jobId).isEqualTo("album:42");
        server.verify();
    }

    @Test
    public void testEnqueueDownload_UnknownAlbumSearchesWholeArtist() {
        server.expect(requestTo(BASE_URL + "/api/v1/album?artistId=7"))
                .andRespond(withSuccess("[{\"id\": 41, \"artistId\": 7, \"title\": \"Blue Lines\"}]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/api/v1/command"))
                .andExpect(jsonPath("$.name").value("ArtistSearch"))
                .andExpect(jsonPath("$.artistId").value(7))
                .andRespond(withSuccess());

        String jobId = client.enqueueDownload(new CatalogDownloadRequest(
                new ArtistCandidate(7L, "mb-1", "Massive Attack"), "Heligoland", false));

        assertThat(jobId).isEqualTo("artist:7");
        server.verify();
    }

    @Test
    public void testGetQueue() {
        server.expect(requestTo(startsWith(BASE_URL + "/api/v1/queue")))
                .andRespond(withSuccess("""
                        {"page": 1, "pageSize": 50, "totalRecords": 1, "records": [
                          {"id": 900, "artistId": 7, "albumId": 42, "title": "Massive Attack - Mezzanine",
                           "status": "downloading", "trackedDownloadState": "downloading", "size": 200.0, "sizeleft": 50.0}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<BackendQueueEntry> queue = client.getQueue();

        assertThat(queue).singleElement().satisfies(entry -> {
            assertThat(entry.serviceJobId()).isEqualTo("album:42");
            assertThat(entry.groupId()).isEqualTo("artist:7");
            assertThat(entry.status()).isEqualTo(DownloadItemStatus.DOWNLOADING);
            assertThat(entry.progress()).isEqualTo(75);
        });
    }

    @Test
    public void testGetHistory_LatestEventPerAlbum() {
        server.expect(requestTo(startsWith(BASE_URL + "/api/v1/history")))
                .andRespond(withSuccess("""
                        {"records": [
                          {"id": 3, "artistId": 7, "albumId": 42, "sourceTitle": "Mezzanine", "eventType": "downloadImported",
                           "data": {"importedPath": "/music/Massive Attack/Mezzanine"}},
                          {"id": 2, "artistId": 7, "albumId": 42, "sourceTitle": "Mezzanine", "eventType": "grabbed"},
                          {"id": 1, "artistId": 8, "albumId": 50, "sourceTitle": "Dummy", "eventType": "downloadFailed",
                           "data": {"message": "No files found"}},
                          {"id": 0, "artistId": 8, "albumId": 51, "sourceTitle": "Third", "eventType": "artistFolderCreated"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<BackendQueueEntry> history = client.getHistory();

        assertThat(history).hasSize(2);
        assertThat(history.get(0).status()).isEqualTo(DownloadItemStatus.COMPLETED);
        assertThat(history.get(0).path()).isEqualTo("/music/Massive Attack/Mezzanine");
        assertThat(history.get(0).progress()).isEqualTo(100);
        assertThat(history.get(1).status()).isEqualTo(DownloadItemStatus.FAILED);
        assertThat(history.get(1).error()).isEqualTo("No files found");
    }

    @Test
    public void testCancel_NothingQueued() {
        server.expect(requestTo(startsWith(BASE_URL + "/api/v1/queue")))
                .andRespond(withSuccess("{\"records\": []}", MediaType.APPLICATION_JSON));

        assertThat(client.cancel("album:42")).isFalse();
    }

    @Test
    public void testCancel_RemovesMatchingQueueItems() {
        server.expect(requestTo(startsWith(BASE_URL + "/api/v1/queue?")))
                .andRespond(withSuccess("""
                        {"records": [{"id": 900, "artistId": 7, "albumId": 42}, {"id": 901, "artistId": 8, "albumId": 50}]}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/api/v1/queue/900?removeFromClient=true"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        assertThat(client.cancel("album:42")).isTrue();
        server.verify();
    }

    @Test
    public void testRequestFailureBecomesBackendException() {
        server.expect(requestTo(startsWith(BASE_URL + "/api/v1/artist/lookup"))).andRespond(withServerError());

        assertThatThrownBy(() -> client.searchArtist("Massive Attack"))
                .isInstanceOf(DownloadBackendException.class)
                .hasMessageStartingWith("Lidarr failed to search artist 'Massive Attack'");
    }

    @Test
    public void testQueueStatus() {
        assertThat(LidarrClient.queueStatus(record("queued", null))).isEqualTo(DownloadItemStatus.QUEUED);
        assertThat(LidarrClient.queueStatus(record("completed", "importPending"))).isEqualTo(DownloadItemStatus.DOWNLOADING);
        assertThat(LidarrClient.queueStatus(record("completed", "imported"))).isEqualTo(DownloadItemStatus.COMPLETED);
        assertThat(LidarrClient.queueStatus(record("warning", "failedPending"))).isEqualTo(DownloadItemStatus.FAILED);
        assertThat(LidarrClient.queueStatus(record("failed", null))).isEqualTo(DownloadItemStatus.FAILED);
    }

    private static LidarrQueueRecord record(String status, String tracked) {
        return new LidarrQueueRecord(1L, 7L, 42L, "Mezzanine", status, tracked, null, null, null, null);
    }
}
