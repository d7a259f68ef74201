package de.bsommerfeld.spellbook.setup;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.spellbook.core.config.SetupPaths;
import de.bsommerfeld.spellbook.core.config.SourcesConfig;
import de.bsommerfeld.spellbook.core.error.SetupException;
import de.bsommerfeld.spellbook.core.progress.ProgressChannel;
import de.bsommerfeld.spellbook.core.progress.ProgressReporter;
import de.bsommerfeld.spellbook.core.progress.SetupStage;
import de.bsommerfeld.spellbook.db.pricing.PriceCachePrepopulator;
import de.bsommerfeld.spellbook.db.pricing.PriceCacheResult;
import de.bsommerfeld.spellbook.setup.build.BuildResult;
import de.bsommerfeld.spellbook.setup.build.DatabaseBuildOrchestrator;
import de.bsommerfeld.spellbook.setup.asset.AssetSyncResult;
import de.bsommerfeld.spellbook.setup.asset.ReleaseArtifact;
import de.bsommerfeld.spellbook.setup.asset.ReleaseAssetSyncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the whole setup pipeline on a background worker:
 * <strong>card database → combo database → gameplay statistics → collection
 * price cache</strong>.
 *
 * <h3>Thread model</h3>
 * A single {@code setup-worker} thread executes the run; the caller only
 * sees the {@link SetupRun} handle. Progress flows one way through the
 * run's {@link ProgressChannel}, the outcome through its future. At most
 * one run is active per manager.
 *
 * <h3>Failure</h3>
 * Only the card database step can fail the run. The release artifact and
 * price steps report degraded outcomes in the {@link SetupReport} instead. A failed
 * run publishes a terminal {@link SetupStage#ERROR} snapshot and completes
 * the future exceptionally.
 */
@Singleton
public class SetupManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SetupManager.class);

    private final DatabaseBuildOrchestrator orchestrator;
    private final ReleaseAssetSyncer assetSyncer;
    private final PriceCachePrepopulator priceCache;
    private final SetupPaths paths;
    private final ReleaseArtifact combos;
    private final ReleaseArtifact gameplay;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
            .setNameFormat("setup-worker")
            .setDaemon(true)
            .build());
    private final AtomicBoolean running = new AtomicBoolean();

    @Inject
    public SetupManager(DatabaseBuildOrchestrator orchestrator, ReleaseAssetSyncer assetSyncer,
            PriceCachePrepopulator priceCache, SourcesConfig sources, SetupPaths paths) {
        this.orchestrator = orchestrator;
        this.assetSyncer = assetSyncer;
        this.priceCache = priceCache;
        this.paths = paths;
        this.combos = ReleaseArtifact.combos(sources, paths);
        this.gameplay = ReleaseArtifact.gameplay(sources, paths);
    }

    /**
     * Starts a run in the background.
     *
     * @param force rebuild the card database even if it is current
     * @throws IllegalStateException if a run is already active
     */
    public SetupRun start(boolean force) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A setup run is already in progress");
        }

        ProgressChannel channel = new ProgressChannel();
        CompletableFuture<SetupReport> result = new CompletableFuture<>();
        try {
            worker.execute(() -> execute(new ProgressReporter(channel), force, result));
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return new SetupRun(channel, result);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * The active flag is cleared before the future completes, so callers
     * reacting to completion may start the next run immediately. Any
     * throwable ends the run, errors included; the future never stays
     * pending.
     */
    private void execute(ProgressReporter progress, boolean force, CompletableFuture<SetupReport> result) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        SetupReport report = null;
        Throwable failure = null;
        try {
            BuildResult database = orchestrator.run(progress, force);
            AssetSyncResult comboResult = assetSyncer.sync(combos, progress);
            AssetSyncResult gameplayResult = assetSyncer.sync(gameplay, progress);
            PriceCacheResult prices = cachePrices(progress);
            report = new SetupReport(database, comboResult, gameplayResult, prices, stopwatch.elapsed());
            LOG.info("Setup finished in {}: {}", stopwatch, report.summary());
            progress.complete(report.summary());
        } catch (Throwable t) {
            failure = t;
            LOG.error("Setup failed after {}", stopwatch, t);
            progress.fail("Setup failed: " + t.getMessage());
        } finally {
            running.set(false);
            if (failure == null) {
                result.complete(report);
            } else {
                result.completeExceptionally(failure);
            }
        }
    }

    private PriceCacheResult cachePrices(ProgressReporter progress) {
        if (!Files.isRegularFile(paths.collectionDatabase())) {
            LOG.debug("No collection database at {}, skipping price cache", paths.collectionDatabase());
            return PriceCacheResult.skipped("No collection database");
        }
        progress.enter(SetupStage.CACHING_PRICES);
        PriceCacheResult prices = priceCache.prepopulate(paths.cardDatabase(), paths.collectionDatabase(),
                paths.priceCache());
        progress.finish(SetupStage.CACHING_PRICES, prices.message());
        return prices;
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
