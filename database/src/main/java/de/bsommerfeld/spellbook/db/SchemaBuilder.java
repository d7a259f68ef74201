package de.bsommerfeld.spellbook.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DDL and pragma scripts of the card database. All SQL lives in
 * {@code sql/*.sql}; this class only decides what runs when.
 *
 * <ul>
 * <li>{@code create-schema}: tables, CHECK constraints, generated
 * legality columns</li>
 * <li>{@code create-indexes}: exact-match, covering and partial indexes,
 * run once after all imports</li>
 * <li>{@code create-search-index}: FTS5 external-content table over
 * {@code cards}, filled by {@code rebuild} and compacted by
 * {@code optimize}</li>
 * </ul>
 */
public class SchemaBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaBuilder.class);

    /**
     * Bulk-load tuning. Must run outside a transaction since SQLite refuses
     * to switch journal modes inside one.
     */
    public void applyBulkPragmas(Connection conn) throws SQLException {
        runScript(conn, "bulk-pragmas");
    }

    public void createSchema(Connection conn) throws SQLException {
        runScript(conn, "create-schema");
        LOG.debug("Card database schema created");
    }

    public void createIndexes(Connection conn) throws SQLException {
        runScript(conn, "create-indexes");
    }

    public void buildSearchIndex(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load("create-search-index"));
            stmt.execute(SqlLoader.load("rebuild-search-index"));
            stmt.execute(SqlLoader.load("optimize-search-index"));
        }
    }

    /**
     * Folds the WAL back into the main file and leaves the database in
     * rollback-journal mode, so the finished file is self-contained. Runs
     * in auto-commit mode.
     */
    public void finalizeFile(Connection conn) throws SQLException {
        runScript(conn, "finalize-pragmas");
    }

    private static void runScript(Connection conn, String name) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadScript(name)) {
                stmt.execute(sql);
            }
        }
    }
}
