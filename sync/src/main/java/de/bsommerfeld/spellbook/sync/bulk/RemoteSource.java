package de.bsommerfeld.spellbook.sync.bulk;

/**
 * One downloadable bulk dataset as advertised by the bulk-data listing.
 *
 * @param name             bulk type, e.g. {@code default_cards}
 * @param downloadLocation URL of the (large) JSON payload
 * @param freshnessMarker  fixed-width UTC ISO-8601 timestamp of the last
 *                         upstream refresh; markers of one family order
 *                         lexicographically
 */
public record RemoteSource(String name, String downloadLocation, String freshnessMarker) {

    /** Whether this source is newer than a previously stored marker. */
    public boolean isNewerThan(String storedMarker) {
        return storedMarker == null || freshnessMarker.compareTo(storedMarker) > 0;
    }
}
