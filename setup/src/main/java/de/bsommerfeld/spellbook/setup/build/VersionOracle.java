package de.bsommerfeld.spellbook.setup.build;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.spellbook.core.config.SourcesConfig;
import de.bsommerfeld.spellbook.core.error.NetworkException;
import de.bsommerfeld.spellbook.core.error.VersionCheckException;
import de.bsommerfeld.spellbook.db.MetaTable;
import de.bsommerfeld.spellbook.sync.bulk.BulkCatalog;
import de.bsommerfeld.spellbook.sync.bulk.BulkDataClient;
import de.bsommerfeld.spellbook.sync.bulk.RemoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides whether the local card database is stale by comparing its stored
 * {@code scryfall_updated_at} with the card bulk file's marker.
 *
 * <h3>Fail-open</h3>
 * A listing that cannot be fetched or lacks expected fields never blocks
 * startup: an existing database is kept as-is, a missing one is reported
 * as needing a build (which then fails on its own downloads).
 */
@Singleton
public class VersionOracle {

    private static final Logger LOG = LoggerFactory.getLogger(VersionOracle.class);

    private final BulkDataClient bulkData;
    private final String cardBulkType;

    @Inject
    public VersionOracle(BulkDataClient bulkData, SourcesConfig sources) {
        this(bulkData, sources.getCardBulkType());
    }

    public VersionOracle(BulkDataClient bulkData, String cardBulkType) {
        this.bulkData = bulkData;
        this.cardBulkType = cardBulkType;
    }

    public FreshnessCheck check(Path localDb) {
        BulkCatalog catalog;
        RemoteSource cards;
        try {
            catalog = bulkData.fetchCatalog();
            cards = catalog.require(cardBulkType);
        } catch (NetworkException | VersionCheckException e) {
            boolean exists = Files.isRegularFile(localDb);
            LOG.warn("Freshness check failed ({}), {}", e.getMessage(),
                    exists ? "keeping local database" : "no local database to fall back to");
            return FreshnessCheck.offline(!exists);
        }

        String remote = cards.freshnessMarker();
        Optional<String> stored = MetaTable.readValue(localDb, MetaTable.SCRYFALL_UPDATED_AT);
        if (stored.isEmpty()) {
            LOG.info("No stored freshness marker in {}, remote is {}", localDb, remote);
            return new FreshnessCheck(true, remote, catalog);
        }

        boolean stale = cards.isNewerThan(stored.get());
        LOG.info("Local card data {} (stored {}, remote {})", stale ? "is stale" : "is current",
                stored.get(), remote);
        return new FreshnessCheck(stale, remote, catalog);
    }
}
