package de.bsommerfeld.spellbook.db.imports;

/**
 * Progress of one import pass in records and source bytes. Byte counts let
 * callers show a ratio before the record total is known.
 */
@FunctionalInterface
public interface SourceProgressListener {

    SourceProgressListener NONE = (records, bytesRead, totalBytes) -> {
    };

    /**
     * @param records    records flushed so far
     * @param bytesRead  bytes of the source file consumed by the parser
     * @param totalBytes size of the source file
     */
    void onProgress(long records, long bytesRead, long totalBytes);
}
