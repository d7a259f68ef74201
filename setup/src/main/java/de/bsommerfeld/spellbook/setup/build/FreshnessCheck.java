package de.bsommerfeld.spellbook.setup.build;

import de.bsommerfeld.spellbook.sync.bulk.BulkCatalog;

/**
 * Outcome of a freshness check against the bulk-data listing.
 *
 * @param needsUpdate  whether the local database should be rebuilt
 * @param remoteMarker {@code updated_at} of the card bulk file, or
 *                     {@code null} when the listing could not be read
 * @param catalog      the fetched listing, {@code null} when offline
 */
public record FreshnessCheck(boolean needsUpdate, String remoteMarker, BulkCatalog catalog) {

    static FreshnessCheck offline(boolean needsUpdate) {
        return new FreshnessCheck(needsUpdate, null, null);
    }

    public boolean isOffline() {
        return catalog == null;
    }
}
