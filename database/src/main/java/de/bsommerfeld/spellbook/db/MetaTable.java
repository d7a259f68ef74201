package de.bsommerfeld.spellbook.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * The {@code meta(key, value)} table shared by the card database and the
 * combo artifact. Freshness markers and build statistics live here.
 */
public final class MetaTable {

    private static final Logger LOG = LoggerFactory.getLogger(MetaTable.class);

    public static final String SCRYFALL_UPDATED_AT = "scryfall_updated_at";
    public static final String RELEASE_UPDATED_AT = "release_updated_at";
    public static final String SCHEMA_VERSION = "schema_version";
    public static final String CREATED_AT = "created_at";
    public static final String CARD_COUNT = "card_count";
    public static final String SET_COUNT = "set_count";
    public static final String RULING_COUNT = "ruling_count";

    private MetaTable() {
    }

    /**
     * Reads a value from the {@code meta} table of {@code dbFile}.
     *
     * <p>
     * Returns empty when the file does not exist, has no {@code meta}
     * table, or has no row for {@code key}. A file that cannot be read at
     * all (e.g. not a database) is also treated as having no value, so
     * the caller rebuilds or re-downloads it.
     */
    public static Optional<String> readValue(Path dbFile, String key) {
        if (!Files.isRegularFile(dbFile)) {
            return Optional.empty();
        }
        try (Connection conn = SqliteFiles.openReadOnly(dbFile)) {
            return readValue(conn, key);
        } catch (SQLException e) {
            LOG.debug("No readable meta.{} in {}: {}", key, dbFile, e.getMessage());
            return Optional.empty();
        }
    }

    public static Optional<String> readValue(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-meta"))) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    public static void ensureTable(Connection conn) throws SQLException {
        try (var stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load("create-meta"));
        }
    }

    public static void write(Connection conn, String key, Object value) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-meta"))) {
            ps.setString(1, key);
            ps.setString(2, value == null ? null : String.valueOf(value));
            ps.executeUpdate();
        }
    }

    /**
     * Writes one value into the {@code meta} table of {@code dbFile},
     * creating the table if it is missing.
     */
    public static void writeValue(Path dbFile, String key, Object value) throws SQLException {
        try (Connection conn = SqliteFiles.open(dbFile)) {
            ensureTable(conn);
            write(conn, key, value);
        }
    }
}
