package de.bsommerfeld.spellbook.db.imports;

/**
 * Notified after every flushed batch.
 */
@FunctionalInterface
public interface ImportListener {

    ImportListener NONE = cumulativeCount -> {
    };

    /** @param cumulativeCount records flushed so far in this pass */
    void onFlush(long cumulativeCount);
}
