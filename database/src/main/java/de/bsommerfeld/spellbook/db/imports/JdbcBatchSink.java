package de.bsommerfeld.spellbook.db.imports;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * {@link BatchSink} writing each batch as one JDBC batch insert. The
 * prepared statement is created once and reused for every flush; close the
 * sink when the import pass is over.
 */
public final class JdbcBatchSink<R> implements BatchSink<R>, AutoCloseable {

    /** Binds one row's values to the insert statement's parameters. */
    @FunctionalInterface
    public interface RowBinder<R> {
        void bind(PreparedStatement ps, R row) throws SQLException;
    }

    private final PreparedStatement statement;
    private final RowBinder<R> binder;
    private long written;

    public JdbcBatchSink(Connection conn, String sql, RowBinder<R> binder) throws SQLException {
        this.statement = conn.prepareStatement(sql);
        this.binder = binder;
    }

    @Override
    public void flush(List<R> batch) throws SQLException {
        for (R row : batch) {
            binder.bind(statement, row);
            statement.addBatch();
        }
        statement.executeBatch();
        written += batch.size();
    }

    public long written() {
        return written;
    }

    @Override
    public void close() throws SQLException {
        statement.close();
    }
}
