package de.bsommerfeld.spellbook.setup;

import de.bsommerfeld.spellbook.db.pricing.PriceCacheResult;
import de.bsommerfeld.spellbook.setup.asset.AssetSyncResult;
import de.bsommerfeld.spellbook.setup.build.BuildResult;

import java.time.Duration;
import java.util.Locale;

/**
 * Final result of one setup run.
 */
public record SetupReport(BuildResult database, AssetSyncResult combos, AssetSyncResult gameplay,
        PriceCacheResult prices, Duration elapsed) {

    /** One-line summary for the terminal status line. */
    public String summary() {
        String db = database.rebuilt()
                ? String.format("Card database rebuilt (%,d cards)", database.cards())
                : "Card database up to date";
        return db + ", combos " + describe(combos)
                + ", gameplay stats " + describe(gameplay)
                + ", prices " + prices.status().name().toLowerCase(Locale.ROOT);
    }

    private static String describe(AssetSyncResult result) {
        return result.status().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
