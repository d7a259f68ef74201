package de.bsommerfeld.spellbook.setup.build;

import com.google.common.base.Stopwatch;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import de.bsommerfeld.spellbook.core.config.ImportConfig;
import de.bsommerfeld.spellbook.core.config.SetupPaths;
import de.bsommerfeld.spellbook.core.config.SourcesConfig;
import de.bsommerfeld.spellbook.core.error.NetworkException;
import de.bsommerfeld.spellbook.core.error.SetupException;
import de.bsommerfeld.spellbook.core.progress.ProgressReporter;
import de.bsommerfeld.spellbook.core.progress.SetupStage;
import de.bsommerfeld.spellbook.db.CardDatabaseBuild;
import de.bsommerfeld.spellbook.db.imports.SourceProgressListener;
import de.bsommerfeld.spellbook.sync.bulk.BulkCatalog;
import de.bsommerfeld.spellbook.sync.download.DownloadProgressListener;
import de.bsommerfeld.spellbook.sync.download.StreamingDownloader;
import de.bsommerfeld.spellbook.sync.download.TransferStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Rebuilds the local card database when the upstream bulk data moved on.
 *
 * <h3>Sequence</h3>
 * <strong>freshness check → downloads → imports → indexes → search index →
 * version stamp</strong>. Downloads run on the calling thread, one after
 * another, into a scratch directory that is removed afterwards whether the
 * build succeeded or not. Everything that touches the database is handed
 * to a single {@code db-build} thread and awaited.
 *
 * <h3>Failure</h3>
 * Any failure aborts the build. The version stamp is written last, so a
 * database left behind by an aborted build carries no freshness marker and
 * the next check rebuilds it.
 */
public class DatabaseBuildOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseBuildOrchestrator.class);

    private final VersionOracle oracle;
    private final StreamingDownloader downloader;
    private final SourcesConfig sources;
    private final SetupPaths paths;
    private final int batchSize;

    @Inject
    public DatabaseBuildOrchestrator(VersionOracle oracle, StreamingDownloader downloader, SourcesConfig sources,
            ImportConfig importing, SetupPaths paths) {
        this(oracle, downloader, sources, paths, importing.getBatchSize());
    }

    public DatabaseBuildOrchestrator(VersionOracle oracle, StreamingDownloader downloader, SourcesConfig sources,
            SetupPaths paths, int batchSize) {
        this.oracle = oracle;
        this.downloader = downloader;
        this.sources = sources;
        this.paths = paths;
        this.batchSize = batchSize;
    }

    /**
     * Checks freshness and rebuilds the card database if needed.
     *
     * @param force rebuild even if the stored marker is current
     * @throws SetupException if a download, import or build step fails
     */
    public BuildResult run(ProgressReporter progress, boolean force) throws SetupException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Path cardDb = paths.cardDatabase();

        progress.enter(SetupStage.CHECKING);
        FreshnessCheck check = oracle.check(cardDb);

        if (!check.needsUpdate() && !force) {
            progress.finish(SetupStage.CHECKING, "Card database is up to date");
            return BuildResult.upToDate(check.remoteMarker(), stopwatch.elapsed());
        }
        if (check.isOffline()) {
            throw new NetworkException("Card database needs a build but the bulk-data listing is unavailable");
        }
        progress.finish(SetupStage.CHECKING, force && !check.needsUpdate()
                ? "Forced rebuild of " + check.remoteMarker()
                : "New card data available: " + check.remoteMarker());

        Path workDir = createWorkDir();
        try {
            SourceFiles files = download(check.catalog(), workDir, progress);
            BuildResult result = buildOnDatabaseThread(files, check.remoteMarker(), progress, stopwatch);
            LOG.info("Card database rebuilt in {}: {} cards, {} sets, {} rulings",
                    stopwatch, result.cards(), result.sets(), result.rulings());
            return result;
        } finally {
            deleteWorkDir(workDir);
        }
    }

    // =====================================================================
    // Downloads
    // =====================================================================

    private record SourceFiles(Path cards, Path sets, Path rulings, Path setMetadata) {
    }

    private SourceFiles download(BulkCatalog catalog, Path workDir, ProgressReporter progress)
            throws SetupException {
        String cardsUrl = catalog.require(sources.getCardBulkType()).downloadLocation();
        String rulingsUrl = catalog.require(sources.getRulingBulkType()).downloadLocation();

        Path cards = fetch(cardsUrl, workDir.resolve("cards.json"), SetupStage.DOWNLOADING_CARDS, progress);
        Path sets = fetch(sources.getSetsUrl(), workDir.resolve("sets.json"), SetupStage.DOWNLOADING_SETS,
                progress);
        Path rulings = fetch(rulingsUrl, workDir.resolve("rulings.json"), SetupStage.DOWNLOADING_RULINGS,
                progress);

        Path setMetadata = null;
        String metadataUrl = sources.getSetMetadataUrl();
        if (metadataUrl != null && !metadataUrl.isBlank()) {
            setMetadata = fetch(metadataUrl, workDir.resolve("SetList.json"), SetupStage.DOWNLOADING_SET_METADATA,
                    progress);
        } else {
            LOG.info("No set metadata URL configured, skipping set enrichment");
        }
        return new SourceFiles(cards, sets, rulings, setMetadata);
    }

    private Path fetch(String url, Path target, SetupStage stage, ProgressReporter progress)
            throws SetupException {
        progress.enter(stage);
        DownloadProgressListener listener = (read, total) -> progress.report(stage,
                total > 0 ? (double) read / total : 0.0,
                TransferStatus.line(stage.label(), read, total));
        try {
            long bytes = downloader.toFile(url, target, listener);
            progress.finish(stage, stage.label() + ": " + TransferStatus.size(bytes));
            return target;
        } catch (IOException e) {
            throw new SetupException("Cannot write " + target.getFileName() + ": " + e.getMessage(), e);
        }
    }

    // =====================================================================
    // Database work
    // =====================================================================

    private BuildResult buildOnDatabaseThread(SourceFiles files, String marker, ProgressReporter progress,
            Stopwatch stopwatch) throws SetupException {
        ExecutorService dbExecutor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("db-build")
                .setDaemon(true)
                .build());
        try {
            Future<BuildResult> build = dbExecutor.submit(() -> build(files, marker, progress, stopwatch));
            return build.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SetupException("Interrupted while building the card database", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } finally {
            dbExecutor.shutdown();
        }
    }

    private BuildResult build(SourceFiles files, String marker, ProgressReporter progress, Stopwatch stopwatch)
            throws SetupException, IOException {
        try (CardDatabaseBuild build = CardDatabaseBuild.open(paths.cardDatabase(), batchSize)) {
            progress.enter(SetupStage.CREATING_SCHEMA);
            build.createSchema();
            progress.finish(SetupStage.CREATING_SCHEMA, "Schema created");

            progress.enter(SetupStage.IMPORTING_SETS);
            long sets = build.importSets(files.sets(), files.setMetadata(),
                    importListener(SetupStage.IMPORTING_SETS, "sets", progress));
            progress.finish(SetupStage.IMPORTING_SETS, String.format("Imported %,d sets", sets));

            progress.enter(SetupStage.IMPORTING_CARDS);
            long cards = build.importCards(files.cards(),
                    importListener(SetupStage.IMPORTING_CARDS, "cards", progress));
            progress.finish(SetupStage.IMPORTING_CARDS, String.format("Imported %,d cards", cards));

            progress.enter(SetupStage.IMPORTING_RULINGS);
            long rulings = build.importRulings(files.rulings(),
                    importListener(SetupStage.IMPORTING_RULINGS, "rulings", progress));
            progress.finish(SetupStage.IMPORTING_RULINGS, String.format("Imported %,d rulings", rulings));

            progress.enter(SetupStage.CREATING_INDEXES);
            build.buildIndexes();
            progress.finish(SetupStage.CREATING_INDEXES, "Indexes created");

            progress.enter(SetupStage.BUILDING_SEARCH_INDEX);
            build.buildSearchIndex();
            progress.finish(SetupStage.BUILDING_SEARCH_INDEX, "Search index built");

            progress.enter(SetupStage.STAMPING_VERSION);
            build.stampVersion(marker);
            build.finish();
            progress.finish(SetupStage.STAMPING_VERSION, "Card data version " + marker);

            return new BuildResult(true, marker, cards, sets, rulings, stopwatch.elapsed());
        }
    }

    private static SourceProgressListener importListener(SetupStage stage, String noun, ProgressReporter progress) {
        return (records, bytesRead, totalBytes) -> progress.report(stage,
                totalBytes > 0 ? (double) bytesRead / totalBytes : 0.0,
                String.format("Imported %,d %s...", records, noun));
    }

    private static SetupException unwrap(Throwable cause) {
        if (cause instanceof SetupException setupException) {
            return setupException;
        }
        if (cause instanceof IOException) {
            return new SetupException("Reading downloaded data failed: " + cause.getMessage(), cause);
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new SetupException("Card database build failed", cause);
    }

    // =====================================================================
    // Scratch directory
    // =====================================================================

    private Path createWorkDir() throws SetupException {
        try {
            Files.createDirectories(paths.dataDirectory());
            return Files.createTempDirectory(paths.dataDirectory(), "download-");
        } catch (IOException e) {
            throw new SetupException("Cannot create download directory in " + paths.dataDirectory(), e);
        }
    }

    private static void deleteWorkDir(Path workDir) {
        try {
            MoreFiles.deleteRecursively(workDir, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            LOG.warn("Could not remove download directory {}", workDir, e);
        }
    }
}
