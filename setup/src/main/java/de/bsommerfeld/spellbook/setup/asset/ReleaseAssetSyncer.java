package de.bsommerfeld.spellbook.setup.asset;

import com.google.common.io.ByteStreams;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.spellbook.core.error.NetworkException;
import de.bsommerfeld.spellbook.core.progress.ProgressReporter;
import de.bsommerfeld.spellbook.core.progress.SetupStage;
import de.bsommerfeld.spellbook.sync.download.StreamingDownloader;
import de.bsommerfeld.spellbook.sync.download.TransferStatus;
import de.bsommerfeld.spellbook.sync.release.Release;
import de.bsommerfeld.spellbook.sync.release.ReleaseAsset;
import de.bsommerfeld.spellbook.sync.release.ReleaseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Keeps supplementary databases in sync with the newest release that
 * publishes them.
 *
 * <h3>Asset selection</h3>
 * Releases are scanned newest first; within a release the gzip variant
 * ({@code <asset>.gz}) is preferred over the plain file. The first release
 * carrying either wins, even if newer releases exist that do not carry the
 * asset at all.
 *
 * <h3>Versioning</h3>
 * The winning release's marker is stored with the artifact as described by
 * its {@link MarkerStorage}. A local artifact whose stored marker is at
 * least the remote marker is left untouched.
 *
 * <h3>Error handling</h3>
 * {@link #sync} never throws. Network failures degrade to
 * {@link AssetSyncResult.Status#OFFLINE} or
 * {@link AssetSyncResult.Status#UNAVAILABLE}; local failures to
 * {@link AssetSyncResult.Status#FAILED}.
 */
@Singleton
public class ReleaseAssetSyncer {

    private static final Logger LOG = LoggerFactory.getLogger(ReleaseAssetSyncer.class);

    private static final String GZIP_SUFFIX = ".gz";

    private final ReleaseClient releases;
    private final StreamingDownloader downloader;

    @Inject
    public ReleaseAssetSyncer(ReleaseClient releases, StreamingDownloader downloader) {
        this.releases = releases;
        this.downloader = downloader;
    }

    /** A release paired with the asset chosen from it. */
    record Selection(Release release, ReleaseAsset asset) {

        boolean compressed() {
            return asset.name().endsWith(GZIP_SUFFIX);
        }
    }

    public AssetSyncResult sync(ReleaseArtifact artifact, ProgressReporter progress) {
        progress.enter(artifact.stage());
        Path target = artifact.target();
        boolean hasLocal = Files.isRegularFile(target);
        Optional<String> stored = artifact.markers().read(target);

        List<Release> listing;
        try {
            listing = releases.fetchReleases(artifact.repository());
        } catch (NetworkException e) {
            return unreachable(artifact, progress, hasLocal, stored,
                    "Release listing unavailable: " + e.getMessage());
        }

        Optional<Selection> selection = select(listing, artifact.assetName());
        if (selection.isEmpty()) {
            return unreachable(artifact, progress, hasLocal, stored,
                    "No release of " + artifact.repository() + " carries " + artifact.assetName());
        }

        String remote = selection.get().release().freshnessMarker();
        if (hasLocal && stored.isPresent() && stored.get().compareTo(remote) >= 0) {
            LOG.info("{} is current ({})", artifact.displayName(), stored.get());
            progress.finish(artifact.stage(), capitalized(artifact) + " is up to date");
            return new AssetSyncResult(AssetSyncResult.Status.UP_TO_DATE, stored.get(), "Already at " + remote);
        }

        return install(artifact, selection.get(), remote, progress, hasLocal, stored);
    }

    /** Picks the first release, newest first, that carries the asset. */
    static Optional<Selection> select(List<Release> listing, String assetName) {
        return listing.stream()
                .sorted(Release.NEWEST_FIRST)
                .map(release -> release.asset(assetName + GZIP_SUFFIX)
                        .or(() -> release.asset(assetName))
                        .map(asset -> new Selection(release, asset)))
                .flatMap(Optional::stream)
                .findFirst();
    }

    // =====================================================================
    // Installation
    // =====================================================================

    private AssetSyncResult install(ReleaseArtifact artifact, Selection selection, String remote,
            ProgressReporter progress, boolean hasLocal, Optional<String> stored) {
        SetupStage stage = artifact.stage();
        Path target = artifact.target();
        ReleaseAsset asset = selection.asset();
        Path download = target.resolveSibling(asset.name() + ".download");
        LOG.info("Downloading {} from release {} ({})", asset.name(), selection.release().tagName(), remote);

        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            downloader.toFile(asset.downloadUrl(), download, (read, total) -> progress.report(stage,
                    total > 0 ? 0.8 * read / total : 0.0,
                    TransferStatus.line("Downloading " + artifact.displayName(), read, total)));
        } catch (NetworkException e) {
            deleteQuietly(download);
            return unreachable(artifact, progress, hasLocal, stored, "Download failed: " + e.getMessage());
        } catch (IOException e) {
            deleteQuietly(download);
            return failed(artifact, progress, "Cannot store " + asset.name(), e);
        }

        Path staged = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            if (selection.compressed()) {
                progress.report(stage, 0.85, "Decompressing " + artifact.displayName() + "...");
                gunzip(download, staged);
                Files.delete(download);
            } else {
                Files.move(download, staged, StandardCopyOption.REPLACE_EXISTING);
            }
            artifact.markers().beforeInstall(staged, target, remote);
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            artifact.markers().afterInstall(target, remote);
        } catch (IOException | SQLException e) {
            deleteQuietly(download);
            deleteQuietly(staged);
            return failed(artifact, progress, "Cannot install " + artifact.displayName(), e);
        }

        LOG.info("{} updated to {}", capitalized(artifact), remote);
        progress.finish(stage, capitalized(artifact) + " updated");
        return new AssetSyncResult(AssetSyncResult.Status.UPDATED, remote,
                "Installed " + asset.name() + " from " + selection.release().tagName());
    }

    private static void gunzip(Path source, Path destination) throws IOException {
        try (InputStream raw = Files.newInputStream(source);
                InputStream in = new GZIPInputStream(raw, 64 * 1024);
                OutputStream out = Files.newOutputStream(destination)) {
            ByteStreams.copy(in, out);
        }
    }

    // =====================================================================
    // Degraded outcomes
    // =====================================================================

    private static AssetSyncResult unreachable(ReleaseArtifact artifact, ProgressReporter progress,
            boolean hasLocal, Optional<String> stored, String reason) {
        if (hasLocal) {
            LOG.warn("{}; keeping local {}", reason, artifact.displayName());
            progress.finish(artifact.stage(), capitalized(artifact) + " offline, using local copy");
            return new AssetSyncResult(AssetSyncResult.Status.OFFLINE, stored.orElse(null), reason);
        }
        LOG.warn("{}; {} unavailable", reason, artifact.displayName());
        progress.finish(artifact.stage(), capitalized(artifact) + " unavailable");
        return new AssetSyncResult(AssetSyncResult.Status.UNAVAILABLE, null, reason);
    }

    private static AssetSyncResult failed(ReleaseArtifact artifact, ProgressReporter progress, String reason,
            Exception e) {
        LOG.error(reason, e);
        progress.finish(artifact.stage(), capitalized(artifact) + " update failed");
        return new AssetSyncResult(AssetSyncResult.Status.FAILED, null, reason + ": " + e.getMessage());
    }

    private static String capitalized(ReleaseArtifact artifact) {
        String name = artifact.displayName();
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete {}", path, e);
        }
    }
}
