package de.bsommerfeld.spellbook.db.pricing;

import java.nio.file.Path;
import java.util.Map;

/**
 * Outcome of a price cache run. Failures are reported here, never thrown.
 *
 * @param status  what happened
 * @param file    the cache file, {@code null} unless written
 * @param prices  entries written, keyed like the cache file
 * @param message human-readable summary
 */
public record PriceCacheResult(Status status, Path file, Map<String, PriceEntry> prices, String message) {

    public enum Status {
        /** Cache file written. */
        WRITTEN,
        /** No collection database (or no collection table) to price. */
        SKIPPED,
        /** Something went wrong; details are in the log. */
        FAILED
    }

    public static PriceCacheResult skipped(String message) {
        return new PriceCacheResult(Status.SKIPPED, null, Map.of(), message);
    }

    public static PriceCacheResult failed(String message) {
        return new PriceCacheResult(Status.FAILED, null, Map.of(), message);
    }
}
