package de.bsommerfeld.spellbook.setup.asset;

import de.bsommerfeld.spellbook.core.error.NetworkException;
import de.bsommerfeld.spellbook.core.progress.ProgressChannel;
import de.bsommerfeld.spellbook.core.progress.ProgressReporter;
import de.bsommerfeld.spellbook.core.progress.SetupStage;
import de.bsommerfeld.spellbook.db.MetaTable;
import de.bsommerfeld.spellbook.db.SqliteFiles;
import de.bsommerfeld.spellbook.sync.download.DownloadProgressListener;
import de.bsommerfeld.spellbook.sync.download.StreamingDownloader;
import de.bsommerfeld.spellbook.sync.release.GitHubRepository;
import de.bsommerfeld.spellbook.sync.release.Release;
import de.bsommerfeld.spellbook.sync.release.ReleaseAsset;
import de.bsommerfeld.spellbook.sync.release.ReleaseClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReleaseAssetSyncerTest {

    private static final GitHubRepository REPO = GitHubRepository.of("example/combo-data");
    private static final String ASSET = "combos.sqlite";

    private static final String MARCH = "2024-03-01T00:00:00Z";
    private static final String APRIL = "2024-04-01T00:00:00Z";

    @Mock
    ReleaseClient releases;

    @Mock
    StreamingDownloader downloader;

    @TempDir
    Path tempDir;

    private Path target;
    private Path artifact;
    private ReleaseArtifact combos;
    private ReleaseAssetSyncer syncer;

    @BeforeEach
    void setUp() throws Exception {
        target = tempDir.resolve("data").resolve(ASSET);
        Files.createDirectories(target.getParent());
        combos = new ReleaseArtifact("combo database", REPO, ASSET, target, SetupStage.SYNCING_COMBOS,
                MarkerStorage.META_TABLE);
        syncer = new ReleaseAssetSyncer(releases, downloader);

        artifact = tempDir.resolve("published.sqlite");
        try (Connection conn = SqliteFiles.open(artifact); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE combos (id TEXT PRIMARY KEY, cards TEXT NOT NULL)");
            stmt.execute("INSERT INTO combos VALUES ('1529-5131', 'Thassa''s Oracle|Demonic Consultation')");
        }
    }

    private static Release release(String tag, String updatedAt, String... assetNames) {
        List<ReleaseAsset> assets = Arrays.stream(assetNames)
                .map(name -> new ReleaseAsset(name, "https://cdn.example/" + tag + "/" + name, 1024))
                .toList();
        return new Release(tag, updatedAt, updatedAt, assets);
    }

    private void serveGzippedArtifact() throws Exception {
        when(downloader.toFile(anyString(), any(Path.class), any(DownloadProgressListener.class)))
                .thenAnswer(invocation -> {
                    Path download = invocation.getArgument(1);
                    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(download))) {
                        Files.copy(artifact, out);
                    }
                    return Files.size(download);
                });
    }

    private void installLocal(String marker) throws Exception {
        Files.copy(artifact, target);
        MetaTable.writeValue(target, MetaTable.RELEASE_UPDATED_AT, marker);
    }

    private static int comboCount(Path db) throws Exception {
        try (Connection conn = SqliteFiles.openReadOnly(db); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM combos")) {
            assertTrue(rs.next());
            return rs.getInt(1);
        }
    }

    @Test
    void sync_shouldInstallAssetFromNewestReleaseRegardlessOfListingOrder() throws Exception {
        installLocal(MARCH);
        when(releases.fetchReleases(REPO)).thenReturn(List.of(
                release("data-march", MARCH, ASSET + ".gz"),
                release("data-april", APRIL, ASSET + ".gz")));
        serveGzippedArtifact();

        AssetSyncResult result = syncer.sync(combos, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.UPDATED, result.status());
        assertEquals(APRIL, result.marker());
        verify(downloader).toFile(eq("https://cdn.example/data-april/combos.sqlite.gz"), any(Path.class),
                any(DownloadProgressListener.class));
        assertEquals(Optional.of(APRIL), MetaTable.readValue(target, MetaTable.RELEASE_UPDATED_AT));
        assertEquals(1, comboCount(target));
    }

    @Test
    void sync_shouldLeaveOnlyTheInstalledArtifact() throws Exception {
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, ASSET + ".gz")));
        serveGzippedArtifact();

        syncer.sync(combos, ProgressReporter.discarding());

        try (var files = Files.list(target.getParent())) {
            assertEquals(List.of(target), files.toList());
        }
    }

    @Test
    void sync_withCurrentLocalCopy_shouldNotDownload() throws Exception {
        installLocal(APRIL);
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, ASSET + ".gz")));

        AssetSyncResult result = syncer.sync(combos, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.UP_TO_DATE, result.status());
        verify(downloader, never()).toFile(anyString(), any(Path.class), any(DownloadProgressListener.class));
    }

    @Test
    void sync_withLocalCopyNewerThanRelease_shouldNotDownload() throws Exception {
        installLocal(APRIL);
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-march", MARCH, ASSET + ".gz")));

        assertEquals(AssetSyncResult.Status.UP_TO_DATE, syncer.sync(combos, ProgressReporter.discarding()).status());
    }

    @Test
    void sync_withUncompressedAsset_shouldInstallAsIs() throws Exception {
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, ASSET)));
        when(downloader.toFile(anyString(), any(Path.class), any(DownloadProgressListener.class)))
                .thenAnswer(invocation -> {
                    Path download = invocation.getArgument(1);
                    Files.copy(artifact, download);
                    return Files.size(download);
                });

        AssetSyncResult result = syncer.sync(combos, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.UPDATED, result.status());
        assertEquals(1, comboCount(target));
        assertEquals(Optional.of(APRIL), MetaTable.readValue(target, MetaTable.RELEASE_UPDATED_AT));
    }

    @Test
    void sync_listingUnreachableWithLocalCopy_shouldReportOffline() throws Exception {
        installLocal(MARCH);
        when(releases.fetchReleases(REPO)).thenThrow(new NetworkException("connect timed out"));

        AssetSyncResult result = syncer.sync(combos, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.OFFLINE, result.status());
        assertEquals(MARCH, result.marker());
        assertEquals(1, comboCount(target));
    }

    @Test
    void sync_listingUnreachableWithoutLocalCopy_shouldReportUnavailable() throws Exception {
        when(releases.fetchReleases(REPO)).thenThrow(new NetworkException("connect timed out"));

        AssetSyncResult result = syncer.sync(combos, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.UNAVAILABLE, result.status());
        assertFalse(Files.exists(target));
    }

    @Test
    void sync_downloadFailure_shouldKeepLocalCopy() throws Exception {
        installLocal(MARCH);
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, ASSET + ".gz")));
        when(downloader.toFile(anyString(), any(Path.class), any(DownloadProgressListener.class)))
                .thenThrow(new NetworkException("No data received for 60s"));

        AssetSyncResult result = syncer.sync(combos, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.OFFLINE, result.status());
        assertEquals(Optional.of(MARCH), MetaTable.readValue(target, MetaTable.RELEASE_UPDATED_AT));
    }

    @Test
    void sync_noReleaseCarriesAsset_shouldReportUnavailable() throws Exception {
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, "gameplay.duckdb.gz")));

        assertEquals(AssetSyncResult.Status.UNAVAILABLE, syncer.sync(combos, ProgressReporter.discarding()).status());
    }

    @Test
    void sync_corruptArchive_shouldReportFailedAndKeepLocalCopy() throws Exception {
        installLocal(MARCH);
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, ASSET + ".gz")));
        when(downloader.toFile(anyString(), any(Path.class), any(DownloadProgressListener.class)))
                .thenAnswer(invocation -> {
                    Path download = invocation.getArgument(1);
                    Files.writeString(download, "definitely not gzip");
                    return Files.size(download);
                });

        AssetSyncResult result = assertDoesNotThrow(() -> syncer.sync(combos, ProgressReporter.discarding()));

        assertEquals(AssetSyncResult.Status.FAILED, result.status());
        assertEquals(Optional.of(MARCH), MetaTable.readValue(target, MetaTable.RELEASE_UPDATED_AT));
        try (var files = Files.list(target.getParent())) {
            assertEquals(List.of(target), files.toList());
        }
    }

    // =====================================================================
    // Sidecar-versioned artifacts
    // =====================================================================

    private static final byte[] DUCKDB_BYTES = "DUCK\0gameplay-stats".getBytes(StandardCharsets.UTF_8);

    private ReleaseArtifact gameplay() {
        return new ReleaseArtifact("gameplay statistics", REPO, "gameplay.duckdb",
                tempDir.resolve("data").resolve("gameplay.duckdb"), SetupStage.SYNCING_GAMEPLAY,
                MarkerStorage.SIDECAR_FILE);
    }

    private void serveGzippedGameplay() throws Exception {
        when(downloader.toFile(anyString(), any(Path.class), any(DownloadProgressListener.class)))
                .thenAnswer(invocation -> {
                    Path download = invocation.getArgument(1);
                    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(download))) {
                        out.write(DUCKDB_BYTES);
                    }
                    return Files.size(download);
                });
    }

    @Test
    void sync_gameplayArtifact_shouldInstallBytesAndWriteSidecarMarker() throws Exception {
        ReleaseArtifact gameplay = gameplay();
        when(releases.fetchReleases(REPO)).thenReturn(List.of(
                release("data-april", APRIL, ASSET + ".gz", "gameplay.duckdb.gz")));
        serveGzippedGameplay();
        ProgressChannel channel = new ProgressChannel();

        AssetSyncResult result = syncer.sync(gameplay, new ProgressReporter(channel));

        assertEquals(AssetSyncResult.Status.UPDATED, result.status());
        verify(downloader).toFile(eq("https://cdn.example/data-april/gameplay.duckdb.gz"), any(Path.class),
                any(DownloadProgressListener.class));
        assertArrayEquals(DUCKDB_BYTES, Files.readAllBytes(gameplay.target()));
        assertEquals(APRIL, Files.readString(MarkerStorage.sidecar(gameplay.target())));
        assertEquals(Optional.of(APRIL), MarkerStorage.SIDECAR_FILE.read(gameplay.target()));
        assertTrue(channel.drain().stream().allMatch(s -> s.stage() == SetupStage.SYNCING_GAMEPLAY));
        try (var files = Files.list(gameplay.target().getParent())) {
            assertEquals(List.of("gameplay.duckdb", "gameplay.duckdb.release"),
                    files.map(f -> f.getFileName().toString()).sorted().toList());
        }
    }

    @Test
    void sync_gameplayArtifactWithCurrentSidecar_shouldNotDownload() throws Exception {
        ReleaseArtifact gameplay = gameplay();
        Files.write(gameplay.target(), DUCKDB_BYTES);
        Files.writeString(MarkerStorage.sidecar(gameplay.target()), APRIL);
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, "gameplay.duckdb.gz")));

        AssetSyncResult result = syncer.sync(gameplay, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.UP_TO_DATE, result.status());
        verify(downloader, never()).toFile(anyString(), any(Path.class), any(DownloadProgressListener.class));
    }

    @Test
    void sync_gameplayArtifactWithoutSidecar_shouldRedownload() throws Exception {
        ReleaseArtifact gameplay = gameplay();
        Files.writeString(gameplay.target(), "older build");
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, "gameplay.duckdb.gz")));
        serveGzippedGameplay();

        assertEquals(AssetSyncResult.Status.UPDATED, syncer.sync(gameplay, ProgressReporter.discarding()).status());
        assertArrayEquals(DUCKDB_BYTES, Files.readAllBytes(gameplay.target()));
    }

    @Test
    void sync_gameplayCorruptArchive_shouldKeepPreviousArtifactAndMarker() throws Exception {
        ReleaseArtifact gameplay = gameplay();
        Files.writeString(gameplay.target(), "march build");
        Files.writeString(MarkerStorage.sidecar(gameplay.target()), MARCH);
        when(releases.fetchReleases(REPO)).thenReturn(List.of(release("data-april", APRIL, "gameplay.duckdb.gz")));
        when(downloader.toFile(anyString(), any(Path.class), any(DownloadProgressListener.class)))
                .thenAnswer(invocation -> {
                    Path download = invocation.getArgument(1);
                    Files.writeString(download, "definitely not gzip");
                    return Files.size(download);
                });

        AssetSyncResult result = syncer.sync(gameplay, ProgressReporter.discarding());

        assertEquals(AssetSyncResult.Status.FAILED, result.status());
        assertEquals("march build", Files.readString(gameplay.target()));
        assertEquals(Optional.of(MARCH), MarkerStorage.SIDECAR_FILE.read(gameplay.target()));
    }

    // =====================================================================
    // Asset selection
    // =====================================================================

    @Test
    void select_shouldPreferCompressedVariant() {
        Optional<ReleaseAssetSyncer.Selection> selection = ReleaseAssetSyncer.select(
                List.of(release("data-april", APRIL, ASSET, ASSET + ".gz")), ASSET);

        assertEquals(ASSET + ".gz", selection.orElseThrow().asset().name());
        assertTrue(selection.get().compressed());
    }

    @Test
    void select_shouldSkipNewerReleasesWithoutAsset() {
        Optional<ReleaseAssetSyncer.Selection> selection = ReleaseAssetSyncer.select(List.of(
                release("tools-may", "2024-05-01T00:00:00Z", "toolkit.zip"),
                release("data-march", MARCH, ASSET),
                release("data-april", APRIL, ASSET + ".gz")), ASSET);

        assertEquals("data-april", selection.orElseThrow().release().tagName());
    }

    @Test
    void select_shouldFallBackToPublishedAtForOrdering() {
        Release edited = new Release("edited", null, "2024-01-01T00:00:00Z", List.of(
                new ReleaseAsset(ASSET, "https://cdn.example/edited", 1)));
        Release fresh = new Release("fresh", null, "2024-06-01T00:00:00Z", List.of(
                new ReleaseAsset(ASSET, "https://cdn.example/fresh", 1)));

        assertEquals("fresh", ReleaseAssetSyncer.select(List.of(edited, fresh), ASSET)
                .orElseThrow().release().tagName());
    }

    @Test
    void select_withoutMatchingAsset_shouldBeEmpty() {
        assertTrue(ReleaseAssetSyncer.select(List.of(release("data-april", APRIL, "other.bin")), ASSET).isEmpty());
    }
}
