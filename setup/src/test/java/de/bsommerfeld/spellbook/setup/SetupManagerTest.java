package de.bsommerfeld.spellbook.setup;

import de.bsommerfeld.spellbook.core.config.SetupPaths;
import de.bsommerfeld.spellbook.core.config.SourcesConfig;
import de.bsommerfeld.spellbook.core.error.NetworkException;
import de.bsommerfeld.spellbook.core.progress.ProgressReporter;
import de.bsommerfeld.spellbook.core.progress.ProgressState;
import de.bsommerfeld.spellbook.core.progress.SetupStage;
import de.bsommerfeld.spellbook.db.pricing.PriceCachePrepopulator;
import de.bsommerfeld.spellbook.db.pricing.PriceCacheResult;
import de.bsommerfeld.spellbook.setup.asset.AssetSyncResult;
import de.bsommerfeld.spellbook.setup.asset.ReleaseArtifact;
import de.bsommerfeld.spellbook.setup.asset.ReleaseAssetSyncer;
import de.bsommerfeld.spellbook.setup.build.BuildResult;
import de.bsommerfeld.spellbook.setup.build.DatabaseBuildOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SetupManagerTest {

    private static final BuildResult REBUILT =
            new BuildResult(true, "2024-01-15T10:00:00Z", 4, 4, 3, Duration.ofSeconds(3));
    private static final AssetSyncResult ASSET_UPDATED =
            new AssetSyncResult(AssetSyncResult.Status.UPDATED, "2024-04-01T00:00:00Z", "Installed");

    @Mock
    DatabaseBuildOrchestrator orchestrator;

    @Mock
    ReleaseAssetSyncer assetSyncer;

    @Mock
    PriceCachePrepopulator priceCache;

    @TempDir
    Path tempDir;

    private SetupPaths paths;
    private SetupManager manager;

    @BeforeEach
    void setUp() {
        paths = new SetupPaths(tempDir, tempDir.resolve("cards.sqlite"), tempDir.resolve("combos.sqlite"),
                tempDir.resolve("gameplay.duckdb"),
                tempDir.resolve("user.sqlite"), tempDir.resolve("price_cache.json"));
        manager = new SetupManager(orchestrator, assetSyncer, priceCache, new SourcesConfig(), paths);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    /** Reads snapshots until the terminal one. */
    private static List<ProgressState> collect(SetupRun run) throws InterruptedException {
        List<ProgressState> states = new ArrayList<>();
        while (true) {
            ProgressState state = run.progress().poll(10, TimeUnit.SECONDS);
            assertNotNull(state, "no terminal progress snapshot");
            states.add(state);
            if (state.isTerminal()) {
                return states;
            }
        }
    }

    @Test
    void start_shouldCompleteWithReportAndTerminalSnapshot() throws Exception {
        doAnswer(invocation -> {
            ProgressReporter progress = invocation.getArgument(0);
            progress.enter(SetupStage.CHECKING);
            progress.report(SetupStage.DOWNLOADING_CARDS, 0.5, "Downloading cards...");
            progress.finish(SetupStage.STAMPING_VERSION, "Card data version 2024-01-15T10:00:00Z");
            return REBUILT;
        }).when(orchestrator).run(any(ProgressReporter.class), eq(false));
        when(assetSyncer.sync(any(ReleaseArtifact.class), any(ProgressReporter.class))).thenReturn(ASSET_UPDATED);

        SetupRun run = manager.start(false);
        List<ProgressState> states = collect(run);
        SetupReport report = run.result().get(10, TimeUnit.SECONDS);

        assertSame(REBUILT, report.database());
        assertSame(ASSET_UPDATED, report.combos());
        assertSame(ASSET_UPDATED, report.gameplay());
        assertEquals(PriceCacheResult.Status.SKIPPED, report.prices().status());

        ProgressState last = states.get(states.size() - 1);
        assertEquals(SetupStage.COMPLETE, last.stage());
        assertEquals(1.0, last.fraction());
        for (int i = 1; i < states.size(); i++) {
            assertTrue(states.get(i).fraction() >= states.get(i - 1).fraction());
        }
    }

    @Test
    void start_shouldPassForceFlagToOrchestrator() throws Exception {
        when(orchestrator.run(any(ProgressReporter.class), anyBoolean())).thenReturn(REBUILT);
        when(assetSyncer.sync(any(ReleaseArtifact.class), any(ProgressReporter.class))).thenReturn(ASSET_UPDATED);

        manager.start(true).result().get(10, TimeUnit.SECONDS);

        verify(orchestrator).run(any(ProgressReporter.class), eq(true));
    }

    @Test
    void start_withoutCollectionDatabase_shouldSkipPriceCache() throws Exception {
        when(orchestrator.run(any(ProgressReporter.class), anyBoolean())).thenReturn(REBUILT);
        when(assetSyncer.sync(any(ReleaseArtifact.class), any(ProgressReporter.class))).thenReturn(ASSET_UPDATED);

        manager.start(false).result().get(10, TimeUnit.SECONDS);

        verifyNoInteractions(priceCache);
    }

    @Test
    void start_withCollectionDatabase_shouldPrepopulatePriceCache() throws Exception {
        Files.writeString(paths.collectionDatabase(), "");
        PriceCacheResult written = new PriceCacheResult(PriceCacheResult.Status.WRITTEN, paths.priceCache(),
                Map.of(), "Cached 0 prices");
        when(orchestrator.run(any(ProgressReporter.class), anyBoolean())).thenReturn(REBUILT);
        when(assetSyncer.sync(any(ReleaseArtifact.class), any(ProgressReporter.class))).thenReturn(ASSET_UPDATED);
        when(priceCache.prepopulate(paths.cardDatabase(), paths.collectionDatabase(), paths.priceCache()))
                .thenReturn(written);

        SetupRun run = manager.start(false);
        List<ProgressState> states = collect(run);

        assertSame(written, run.result().get(10, TimeUnit.SECONDS).prices());
        assertTrue(states.stream().anyMatch(s -> s.stage() == SetupStage.CACHING_PRICES));
    }

    @Test
    void start_buildFailure_shouldPublishErrorAndFailFuture() throws Exception {
        doAnswer(invocation -> {
            ProgressReporter progress = invocation.getArgument(0);
            progress.report(SetupStage.DOWNLOADING_CARDS, 0.5, "Downloading cards...");
            throw new NetworkException("HTTP 503 for https://data.example/cards.json");
        }).when(orchestrator).run(any(ProgressReporter.class), anyBoolean());

        SetupRun run = manager.start(false);
        List<ProgressState> states = collect(run);

        ProgressState last = states.get(states.size() - 1);
        assertEquals(SetupStage.ERROR, last.stage());
        assertEquals(SetupStage.DOWNLOADING_CARDS.at(0.5), last.fraction(), 1e-9);
        assertTrue(last.status().contains("HTTP 503"));

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> run.result().get(10, TimeUnit.SECONDS));
        assertInstanceOf(NetworkException.class, failure.getCause());
        verify(assetSyncer, never()).sync(any(ReleaseArtifact.class), any(ProgressReporter.class));
    }

    @Test
    void start_whileRunning_shouldRejectSecondRun() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.run(any(ProgressReporter.class), anyBoolean())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return REBUILT;
        });
        when(assetSyncer.sync(any(ReleaseArtifact.class), any(ProgressReporter.class))).thenReturn(ASSET_UPDATED);

        SetupRun first = manager.start(false);
        assertTrue(manager.isRunning());
        assertThrows(IllegalStateException.class, () -> manager.start(false));

        release.countDown();
        first.result().get(10, TimeUnit.SECONDS);
        assertFalse(manager.isRunning());
    }

    @Test
    void start_afterCompletion_shouldAllowNextRun() throws Exception {
        when(orchestrator.run(any(ProgressReporter.class), anyBoolean())).thenReturn(REBUILT);
        when(assetSyncer.sync(any(ReleaseArtifact.class), any(ProgressReporter.class))).thenReturn(ASSET_UPDATED);

        manager.start(false).result().get(10, TimeUnit.SECONDS);
        SetupReport second = manager.start(false).result().get(10, TimeUnit.SECONDS);

        assertNotNull(second);
    }

    @Test
    void start_shouldSyncCombosBeforeGameplayStatistics() throws Exception {
        when(orchestrator.run(any(ProgressReporter.class), anyBoolean())).thenReturn(REBUILT);
        when(assetSyncer.sync(any(ReleaseArtifact.class), any(ProgressReporter.class))).thenReturn(ASSET_UPDATED);

        manager.start(false).result().get(10, TimeUnit.SECONDS);

        ArgumentCaptor<ReleaseArtifact> artifacts = ArgumentCaptor.forClass(ReleaseArtifact.class);
        verify(assetSyncer, times(2)).sync(artifacts.capture(), any(ProgressReporter.class));
        assertEquals(List.of(paths.comboDatabase(), paths.gameplayDatabase()),
                artifacts.getAllValues().stream().map(ReleaseArtifact::target).toList());
        assertEquals(List.of(SetupStage.SYNCING_COMBOS, SetupStage.SYNCING_GAMEPLAY),
                artifacts.getAllValues().stream().map(ReleaseArtifact::stage).toList());
    }

    @Test
    void start_errorDuringBuild_shouldFailFutureAndReleaseManager() throws Exception {
        when(orchestrator.run(any(ProgressReporter.class), anyBoolean()))
                .thenThrow(new OutOfMemoryError("Java heap space"));

        SetupRun run = manager.start(false);
        List<ProgressState> states = collect(run);

        assertEquals(SetupStage.ERROR, states.get(states.size() - 1).stage());
        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> run.result().get(10, TimeUnit.SECONDS));
        assertInstanceOf(OutOfMemoryError.class, failure.getCause());
        assertFalse(manager.isRunning());
    }
}
