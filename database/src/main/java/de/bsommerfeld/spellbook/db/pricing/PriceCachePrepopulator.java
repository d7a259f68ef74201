package de.bsommerfeld.spellbook.db.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import com.google.inject.Singleton;
import de.bsommerfeld.spellbook.db.SqlLoader;
import de.bsommerfeld.spellbook.db.SqliteFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Warms the collection price cache right after a database build, so the
 * first collection view does not have to price every entry.
 *
 * <p>
 * Entries with a set code and collector number are priced by printing,
 * everything else by name (newest printing with a price wins). Lookups run
 * in batches of {@value #LOOKUP_BATCH_SIZE} to stay below SQLite's
 * parameter limit. Prices are read as cents and written as dollars.
 *
 * <h3>Cache file</h3>
 *
 * <pre>
 * {"timestamp": 1718000000, "prices": {"Lightning Bolt|LEA|162": [1.50, null], "Counterspell": [0.25, 1.10]}}
 * </pre>
 *
 * <p>
 * This step is optional for the pipeline: every failure is logged and
 * reported in the {@link PriceCacheResult}, never thrown.
 */
@Singleton
public class PriceCachePrepopulator {

    private static final Logger LOG = LoggerFactory.getLogger(PriceCachePrepopulator.class);

    static final int LOOKUP_BATCH_SIZE = 200;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;

    public PriceCachePrepopulator() {
        this(Clock.systemUTC());
    }

    PriceCachePrepopulator(Clock clock) {
        this.clock = clock;
    }

    public PriceCacheResult prepopulate(Path cardDb, Path collectionDb, Path cacheFile) {
        if (!Files.isRegularFile(collectionDb)) {
            LOG.debug("No collection database at {}, skipping price cache", collectionDb);
            return PriceCacheResult.skipped("No collection database");
        }

        try {
            List<CollectionEntry> entries = readCollection(collectionDb);
            if (entries.isEmpty()) {
                return PriceCacheResult.skipped("Collection is empty");
            }

            Map<String, PriceEntry> prices = lookUpPrices(cardDb, entries);
            writeCache(cacheFile, prices);
            LOG.info("Cached prices for {} of {} collection entries", prices.size(), entries.size());
            return new PriceCacheResult(PriceCacheResult.Status.WRITTEN, cacheFile,
                    Collections.unmodifiableMap(prices),
                    "Cached " + prices.size() + " prices");
        } catch (MissingCollectionTableException e) {
            LOG.debug("Collection database {} has no collection table", collectionDb);
            return PriceCacheResult.skipped("No collection table");
        } catch (SQLException | IOException | RuntimeException e) {
            LOG.error("Failed to prepopulate price cache", e);
            return PriceCacheResult.failed("Price cache failed: " + e.getMessage());
        }
    }

    // =====================================================================
    // Collection
    // =====================================================================

    private static List<CollectionEntry> readCollection(Path collectionDb)
            throws SQLException, MissingCollectionTableException {
        List<CollectionEntry> entries = new ArrayList<>();
        try (Connection conn = SqliteFiles.openReadOnly(collectionDb)) {
            if (!hasTable(conn, "collection_cards")) {
                throw new MissingCollectionTableException();
            }
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-collection-printings"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new CollectionEntry(rs.getString(1), rs.getString(2), rs.getString(3)));
                }
            }
        }
        return entries;
    }

    private static boolean hasTable(Connection conn, String table) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, table, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    // =====================================================================
    // Price lookups
    // =====================================================================

    private static Map<String, PriceEntry> lookUpPrices(Path cardDb, List<CollectionEntry> entries)
            throws SQLException {
        List<CollectionEntry> withPrinting = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (CollectionEntry entry : entries) {
            if (entry.hasPrinting()) {
                withPrinting.add(entry);
            } else {
                names.add(entry.cardName());
            }
        }

        Map<String, PriceEntry> prices = new LinkedHashMap<>();
        try (Connection conn = SqliteFiles.openReadOnly(cardDb)) {
            Map<String, PriceEntry> byPrinting = pricesByPrinting(conn, withPrinting);
            for (CollectionEntry entry : withPrinting) {
                PriceEntry price = byPrinting.get(entry.printingKey());
                if (price != null) {
                    prices.put(entry.cacheKey(), price);
                }
            }

            Map<String, PriceEntry> byName = pricesByName(conn, new ArrayList<>(names));
            for (String name : names) {
                PriceEntry price = byName.get(name.toLowerCase(Locale.ROOT));
                if (price != null) {
                    prices.put(name, price);
                }
            }
        }
        return prices;
    }

    /**
     * Keys are {@code SET|number} with leading zeros stripped. Both sides of
     * the comparison are trimmed, so {@code 062} in the collection finds
     * {@code 62} in the database and vice versa.
     */
    private static Map<String, PriceEntry> pricesByPrinting(Connection conn, List<CollectionEntry> entries)
            throws SQLException {
        Map<String, PriceEntry> results = new HashMap<>();
        String template = SqlLoader.load("select-prices-by-printing");

        for (List<CollectionEntry> batch : Lists.partition(entries, LOOKUP_BATCH_SIZE)) {
            List<String> conditions = new ArrayList<>(batch.size());
            List<String> params = new ArrayList<>(batch.size() * 3);
            for (CollectionEntry entry : batch) {
                conditions.add("(UPPER(set_code) = ? AND (collector_number = ?"
                        + " OR ltrim(collector_number, '0') = ltrim(?, '0')))");
                params.add(entry.setCode().toUpperCase(Locale.ROOT));
                params.add(entry.collectorNumber());
                params.add(entry.collectorNumber());
            }

            try (PreparedStatement ps = conn.prepareStatement(
                    String.format(template, String.join(" OR ", conditions)))) {
                bindAll(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String set = rs.getString(1);
                        String number = rs.getString(2);
                        if (set != null && number != null) {
                            results.put(CollectionEntry.printingKey(set, number),
                                    PriceEntry.fromCents(getLong(rs, 3), getLong(rs, 4)));
                        }
                    }
                }
            }
        }
        return results;
    }

    /**
     * Keys are lower-cased names. Rows arrive best-first (non-token, priced,
     * newest), so the first row per name is kept.
     */
    private static Map<String, PriceEntry> pricesByName(Connection conn, List<String> names) throws SQLException {
        Map<String, PriceEntry> results = new HashMap<>();
        String template = SqlLoader.load("select-prices-by-name");

        for (List<String> batch : Lists.partition(names, LOOKUP_BATCH_SIZE)) {
            String placeholders = String.join(",", Collections.nCopies(batch.size(), "?"));
            try (PreparedStatement ps = conn.prepareStatement(String.format(template, placeholders))) {
                bindAll(ps, batch);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String name = rs.getString(1);
                        if (name != null) {
                            results.putIfAbsent(name.toLowerCase(Locale.ROOT),
                                    PriceEntry.fromCents(getLong(rs, 2), getLong(rs, 3)));
                        }
                    }
                }
            }
        }
        return results;
    }

    private static void bindAll(PreparedStatement ps, List<String> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setString(i + 1, params.get(i));
        }
    }

    private static Long getLong(ResultSet rs, int column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    // =====================================================================
    // Cache file
    // =====================================================================

    private void writeCache(Path cacheFile, Map<String, PriceEntry> prices) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("timestamp", clock.instant().getEpochSecond());
        document.put("prices", prices);

        Path parent = cacheFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), document);
        Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static final class MissingCollectionTableException extends Exception {
    }
}
