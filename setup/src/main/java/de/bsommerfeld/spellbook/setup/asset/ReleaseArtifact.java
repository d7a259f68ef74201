package de.bsommerfeld.spellbook.setup.asset;

import de.bsommerfeld.spellbook.core.config.SetupPaths;
import de.bsommerfeld.spellbook.core.config.SourcesConfig;
import de.bsommerfeld.spellbook.core.progress.SetupStage;
import de.bsommerfeld.spellbook.sync.release.GitHubRepository;

import java.nio.file.Path;

/**
 * A supplementary database published as a release asset.
 *
 * @param displayName name used in status lines and log output
 * @param repository  repository whose releases carry the asset
 * @param assetName   uncompressed asset name; {@code <assetName>.gz} is
 *                    preferred when a release carries both
 * @param target      local install location
 * @param stage       progress stage the sync reports under
 * @param markers     where the installed release marker is kept
 */
public record ReleaseArtifact(String displayName, GitHubRepository repository, String assetName, Path target,
        SetupStage stage, MarkerStorage markers) {

    /** The combo database, a SQLite file versioned through its {@code meta} table. */
    public static ReleaseArtifact combos(SourcesConfig sources, SetupPaths paths) {
        return new ReleaseArtifact("combo database", GitHubRepository.of(sources.getComboRepository()),
                sources.getComboAsset(), paths.comboDatabase(), SetupStage.SYNCING_COMBOS, MarkerStorage.META_TABLE);
    }

    /** Gameplay statistics. A DuckDB file, so the marker lives in a sidecar. */
    public static ReleaseArtifact gameplay(SourcesConfig sources, SetupPaths paths) {
        return new ReleaseArtifact("gameplay statistics", GitHubRepository.of(sources.getGameplayRepository()),
                sources.getGameplayAsset(), paths.gameplayDatabase(), SetupStage.SYNCING_GAMEPLAY,
                MarkerStorage.SIDECAR_FILE);
    }
}
