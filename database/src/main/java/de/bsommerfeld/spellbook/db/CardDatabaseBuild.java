package de.bsommerfeld.spellbook.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.CountingInputStream;
import de.bsommerfeld.spellbook.core.error.RecordParseException;
import de.bsommerfeld.spellbook.core.error.SchemaException;
import de.bsommerfeld.spellbook.db.imports.CardTransformer;
import de.bsommerfeld.spellbook.db.imports.ImportListener;
import de.bsommerfeld.spellbook.db.imports.JdbcBatchSink;
import de.bsommerfeld.spellbook.db.imports.RowBinders;
import de.bsommerfeld.spellbook.db.imports.SourceProgressListener;
import de.bsommerfeld.spellbook.db.imports.StreamingImporter;
import de.bsommerfeld.spellbook.db.model.CardRow;
import de.bsommerfeld.spellbook.db.model.Ruling;
import de.bsommerfeld.spellbook.db.model.ScryfallCard;
import de.bsommerfeld.spellbook.db.model.ScryfallSet;
import de.bsommerfeld.spellbook.db.model.SetMetadata;
import de.bsommerfeld.spellbook.db.model.SetRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One wholesale build of the card database file, driven phase by phase.
 *
 * <h3>Phases</h3>
 * Every public step corresponds to a {@link BuildPhase} transition and is
 * rejected with {@link IllegalStateException} when called out of order.
 * Each transition runs in its own transaction and commits before the phase
 * advances; a failing step rolls back and leaves the phase unchanged. The
 * phase is not persisted: a process that dies mid-build leaves an
 * unstamped file that the next freshness check rebuilds.
 *
 * <h3>Connection</h3>
 * The build holds a single connection for its whole lifetime and must be
 * driven from one thread.
 *
 * <pre>{@code
 * try (CardDatabaseBuild build = CardDatabaseBuild.open(dbFile, 5000)) {
 *     build.createSchema();
 *     build.importSets(setsJson, setListJson, listener);
 *     build.importCards(cardsJson, listener);
 *     build.importRulings(rulingsJson, listener);
 *     build.buildIndexes();
 *     build.buildSearchIndex();
 *     build.stampVersion(marker);
 *     build.finish();
 * }
 * }</pre>
 */
public final class CardDatabaseBuild implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CardDatabaseBuild.class);

    public static final int SCHEMA_VERSION = 1;

    @FunctionalInterface
    private interface PhaseWork<V> {
        V run(Connection conn) throws SQLException, RecordParseException, IOException;
    }

    private final Path dbFile;
    private final Connection conn;
    private final SchemaBuilder schema;
    private final ObjectMapper mapper;
    private final int batchSize;

    private BuildPhase phase = BuildPhase.INIT;

    private CardDatabaseBuild(Path dbFile, Connection conn, SchemaBuilder schema, ObjectMapper mapper,
            int batchSize) {
        this.dbFile = dbFile;
        this.conn = conn;
        this.schema = schema;
        this.mapper = mapper;
        this.batchSize = batchSize;
    }

    /**
     * Removes any previous database at {@code dbFile} (including WAL and
     * shared-memory siblings) and opens a fresh one tuned for bulk loading.
     *
     * @throws SchemaException if the old file cannot be removed or the new
     *                         one cannot be opened
     */
    public static CardDatabaseBuild open(Path dbFile, int batchSize) throws SchemaException {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        try {
            SqliteFiles.deleteWithSidecars(dbFile);
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new SchemaException("Cannot replace database file " + dbFile, e);
        }

        SchemaBuilder schema = new SchemaBuilder();
        Connection conn = null;
        try {
            conn = SqliteFiles.open(dbFile);
            schema.applyBulkPragmas(conn);
            conn.setAutoCommit(false);
            LOG.info("Building card database at {}", dbFile);
            return new CardDatabaseBuild(dbFile, conn, schema, new ObjectMapper(), batchSize);
        } catch (SQLException e) {
            closeQuietly(conn);
            throw new SchemaException("Cannot open database " + dbFile, e);
        }
    }

    public BuildPhase phase() {
        return phase;
    }

    public Path file() {
        return dbFile;
    }

    // =====================================================================
    // Phase steps
    // =====================================================================

    public void createSchema() throws SchemaException {
        runUnchecked(BuildPhase.SCHEMA_CREATED, c -> {
            schema.createSchema(c);
            return null;
        });
    }

    /**
     * Imports the set listing, enriched with block and size information
     * from the optional set metadata file.
     *
     * @param setMetadataJson may be {@code null} to skip enrichment
     * @return number of sets imported
     */
    public long importSets(Path setsJson, Path setMetadataJson, SourceProgressListener listener)
            throws SchemaException, RecordParseException, IOException {
        Map<String, SetMetadata> metadata = setMetadataJson != null
                ? readSetMetadata(setMetadataJson)
                : Map.of();

        StreamingImporter<ScryfallSet, SetRow> importer = new StreamingImporter<>(mapper, ScryfallSet.class,
                set -> SetRow.of(set, metadata.getOrDefault(lower(set.code()), SetMetadata.NONE)),
                "data", batchSize);
        return importSource(setsJson, importer, SqlLoader.load("insert-set"), RowBinders.SET, listener);
    }

    /** Streams the card bulk file into {@code cards}. */
    public long importCards(Path cardsJson, SourceProgressListener listener)
            throws SchemaException, RecordParseException, IOException {
        StreamingImporter<ScryfallCard, CardRow> importer = new StreamingImporter<>(mapper, ScryfallCard.class,
                new CardTransformer(mapper), "data", batchSize);
        return importSource(cardsJson, importer, SqlLoader.load("insert-card"), RowBinders.CARD, listener);
    }

    public long importRulings(Path rulingsJson, SourceProgressListener listener)
            throws SchemaException, RecordParseException, IOException {
        StreamingImporter<Ruling, Ruling> importer = StreamingImporter.identity(mapper, Ruling.class, "data",
                batchSize);
        return importSource(rulingsJson, importer, SqlLoader.load("insert-ruling"), RowBinders.RULING, listener);
    }

    public void buildIndexes() throws SchemaException {
        runUnchecked(BuildPhase.INDEXES_BUILT, c -> {
            schema.createIndexes(c);
            return null;
        });
    }

    public void buildSearchIndex() throws SchemaException {
        runUnchecked(BuildPhase.SEARCH_INDEX_BUILT, c -> {
            schema.buildSearchIndex(c);
            return null;
        });
    }

    /**
     * Writes the freshness marker, schema version, build time and row
     * counts into {@code meta}. Only a stamped file counts as up to date.
     */
    public void stampVersion(String freshnessMarker) throws SchemaException {
        runUnchecked(BuildPhase.VERSION_STAMPED, c -> {
            MetaTable.write(c, MetaTable.SCRYFALL_UPDATED_AT, freshnessMarker);
            MetaTable.write(c, MetaTable.SCHEMA_VERSION, SCHEMA_VERSION);
            MetaTable.write(c, MetaTable.CREATED_AT, Instant.now().toString());
            MetaTable.write(c, MetaTable.CARD_COUNT, countRows(c, "cards"));
            MetaTable.write(c, MetaTable.SET_COUNT, countRows(c, "sets"));
            MetaTable.write(c, MetaTable.RULING_COUNT, countRows(c, "rulings"));
            return null;
        });
    }

    /**
     * Checkpoints the WAL, switches back to rollback-journal mode and closes
     * the connection.
     */
    public void finish() throws SchemaException {
        requireTransition(BuildPhase.DONE);
        try {
            conn.setAutoCommit(true);
            schema.finalizeFile(conn);
            conn.close();
            phase = BuildPhase.DONE;
            LOG.info("Card database at {} finished", dbFile);
        } catch (SQLException e) {
            throw new SchemaException("Finalizing " + dbFile + " failed", e);
        }
    }

    /** Rolls back uncommitted work and closes the connection if still open. */
    @Override
    public void close() {
        if (phase == BuildPhase.DONE) {
            return;
        }
        LOG.warn("Card database build closed in phase {}; file is left unstamped", phase);
        rollbackQuietly();
        closeQuietly(conn);
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private <T, R> long importSource(Path json, StreamingImporter<T, R> importer, String sql,
            JdbcBatchSink.RowBinder<R> binder, SourceProgressListener listener)
            throws SchemaException, RecordParseException, IOException {
        long totalBytes = Files.size(json);
        return transition(BuildPhase.SOURCE_IMPORTED, c -> {
            try (InputStream raw = new BufferedInputStream(Files.newInputStream(json));
                    CountingInputStream counting = new CountingInputStream(raw);
                    JdbcBatchSink<R> sink = new JdbcBatchSink<>(c, sql, binder)) {
                long count = importer.importFrom(counting, sink,
                        records -> listener.onProgress(records, counting.getCount(), totalBytes));
                LOG.info("Imported {} records from {}", count, json.getFileName());
                return count;
            }
        });
    }

    private Map<String, SetMetadata> readSetMetadata(Path json) throws RecordParseException, IOException {
        Map<String, SetMetadata> byCode = new HashMap<>();
        StreamingImporter<SetMetadata, SetMetadata> importer = StreamingImporter.identity(mapper,
                SetMetadata.class, "data", batchSize);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(json))) {
            importer.importFrom(in, batch -> {
                for (SetMetadata meta : batch) {
                    if (meta.code() != null) {
                        byCode.put(lower(meta.code()), meta);
                    }
                }
            }, ImportListener.NONE);
        } catch (SQLException e) {
            throw new IllegalStateException("In-memory sink cannot fail", e);
        }
        return byCode;
    }

    /** Transition for steps that cannot raise parse or I/O failures. */
    private void runUnchecked(BuildPhase target, PhaseWork<Void> work) throws SchemaException {
        try {
            transition(target, work);
        } catch (RecordParseException | IOException e) {
            throw new SchemaException(target + " failed", e);
        }
    }

    private <V> V transition(BuildPhase target, PhaseWork<V> work)
            throws SchemaException, RecordParseException, IOException {
        requireTransition(target);
        try {
            V result = work.run(conn);
            conn.commit();
            LOG.debug("Build phase {} -> {}", phase, target);
            phase = target;
            return result;
        } catch (SQLException e) {
            rollbackQuietly();
            throw new SchemaException(target + " failed: " + e.getMessage(), e);
        } catch (RecordParseException | IOException | RuntimeException e) {
            rollbackQuietly();
            throw e;
        }
    }

    private void requireTransition(BuildPhase target) {
        if (!phase.canAdvanceTo(target)) {
            throw new IllegalStateException("Cannot move build from " + phase + " to " + target);
        }
    }

    private static long countRows(Connection c, String table) throws SQLException {
        try (Statement stmt = c.createStatement();
                ResultSet rs = stmt.executeQuery(String.format(SqlLoader.load("count-rows"), table))) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private static String lower(String code) {
        return code == null ? "" : code.toLowerCase(Locale.ROOT);
    }

    private void rollbackQuietly() {
        try {
            if (!conn.isClosed() && !conn.getAutoCommit()) {
                conn.rollback();
            }
        } catch (SQLException e) {
            LOG.warn("Rollback of card database build failed", e);
        }
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.warn("Closing card database connection failed", e);
        }
    }
}
