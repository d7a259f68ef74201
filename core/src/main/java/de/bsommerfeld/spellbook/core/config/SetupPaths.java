package de.bsommerfeld.spellbook.core.config;

import java.nio.file.Path;

/**
 * Absolute locations of every file the setup pipeline reads or replaces.
 *
 * @param dataDirectory      root for all files below, also hosts the
 *                           temporary download directory
 * @param cardDatabase       primary card database, rebuilt wholesale
 * @param comboDatabase      combo artifact synced from the release listing
 * @param gameplayDatabase   gameplay statistics artifact, synced the same way
 * @param collectionDatabase user collection store, read only
 * @param priceCache         warm price cache written after a build
 */
public record SetupPaths(Path dataDirectory, Path cardDatabase, Path comboDatabase,
        Path gameplayDatabase, Path collectionDatabase, Path priceCache) {
}
