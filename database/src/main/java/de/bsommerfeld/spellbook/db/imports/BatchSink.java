package de.bsommerfeld.spellbook.db.imports;

import java.sql.SQLException;
import java.util.List;

/**
 * Receives full (and one final partial) batches from a
 * {@link StreamingImporter}. The batch list is reused after the call
 * returns; implementations must not keep a reference to it.
 */
@FunctionalInterface
public interface BatchSink<R> {

    void flush(List<R> batch) throws SQLException;
}
