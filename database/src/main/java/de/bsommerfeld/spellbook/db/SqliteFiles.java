package de.bsommerfeld.spellbook.db;

import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opening and removing SQLite database files.
 *
 * <p>
 * A new {@link Connection} is opened per unit of work and closed right
 * after; SQLite serializes writes at the file level, so pooling buys
 * nothing here.
 */
public final class SqliteFiles {

    private static final String[] SIDECAR_SUFFIXES = {"-wal", "-shm", "-journal"};

    private SqliteFiles() {
    }

    public static String url(Path dbFile) {
        return "jdbc:sqlite:" + dbFile.toAbsolutePath();
    }

    /** Opens (and creates, if missing) a read-write connection. */
    public static Connection open(Path dbFile) throws SQLException {
        return DriverManager.getConnection(url(dbFile));
    }

    /**
     * Opens an existing file read-only. Never creates the file; callers
     * check for existence first.
     */
    public static Connection openReadOnly(Path dbFile) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection(url(dbFile), config.toProperties());
    }

    /**
     * Deletes a database file together with its WAL, shared-memory and
     * rollback-journal siblings. A stale {@code -wal} next to a fresh file
     * would otherwise be replayed into it on the next open.
     */
    public static void deleteWithSidecars(Path dbFile) throws IOException {
        Files.deleteIfExists(dbFile);
        for (String suffix : SIDECAR_SUFFIXES) {
            Files.deleteIfExists(dbFile.resolveSibling(dbFile.getFileName() + suffix));
        }
    }
}
