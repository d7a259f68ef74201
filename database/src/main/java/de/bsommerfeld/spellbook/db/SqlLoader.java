package de.bsommerfeld.spellbook.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads and caches SQL from classpath resource files under {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-card.sql}, {@code select-prices-by-name.sql}.
 * Files ending in {@code %s} placeholders are templates for statements
 * whose shape depends on the batch (e.g. {@code IN (?, ?, ...)}); callers
 * fill them with {@link String#format} and bind values as usual.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();
    private static final Pattern STATEMENT_SEPARATOR = Pattern.compile(";\\s*(\\r?\\n|$)");

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath,
     * trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Splits a multi-statement script into individual statements. A
     * statement ends at a semicolon followed by a line break or the end of
     * the file; chunks consisting only of comments are dropped.
     */
    public static List<String> loadScript(String name) {
        List<String> statements = new ArrayList<>();
        for (String chunk : STATEMENT_SEPARATOR.split(load(name))) {
            String sql = chunk.trim();
            if (!sql.isEmpty() && !isCommentOnly(sql)) {
                statements.add(sql);
            }
        }
        return statements;
    }

    private static boolean isCommentOnly(String sql) {
        for (String line : sql.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("--")) {
                return false;
            }
        }
        return true;
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
