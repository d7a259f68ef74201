package de.bsommerfeld.spellbook.sync.bulk;

import de.bsommerfeld.spellbook.core.error.VersionCheckException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed bulk-data listing, keyed by bulk type.
 */
public final class BulkCatalog {

    private final Map<String, RemoteSource> sources;

    public BulkCatalog(Map<String, RemoteSource> sources) {
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public Optional<RemoteSource> find(String type) {
        return Optional.ofNullable(sources.get(type));
    }

    /**
     * @throws VersionCheckException if the listing does not advertise
     *                               {@code type}
     */
    public RemoteSource require(String type) throws VersionCheckException {
        RemoteSource source = sources.get(type);
        if (source == null) {
            throw new VersionCheckException("Bulk data listing has no entry of type '" + type + "'");
        }
        return source;
    }

    public Map<String, RemoteSource> sources() {
        return sources;
    }

    @Override
    public String toString() {
        return "BulkCatalog" + sources.keySet();
    }
}
