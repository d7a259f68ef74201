package de.bsommerfeld.spellbook.setup.asset;

/**
 * Outcome of one release artifact sync. None of the outcomes is fatal to the
 * setup pipeline.
 *
 * @param status the outcome
 * @param marker release marker now stored locally, {@code null} if none
 * @param detail human-readable explanation for logs and status lines
 */
public record AssetSyncResult(Status status, String marker, String detail) {

    public enum Status {
        /** A newer artifact was downloaded and installed. */
        UPDATED,
        /** The local artifact already matches the newest release carrying it. */
        UP_TO_DATE,
        /** The release listing or download failed; the local copy stays in use. */
        OFFLINE,
        /** No local copy exists and none could be obtained. */
        UNAVAILABLE,
        /** Downloaded, but decompressing or installing it failed. */
        FAILED
    }
}
