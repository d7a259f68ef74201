package de.bsommerfeld.spellbook.sync.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.spellbook.core.config.SourcesConfig;
import de.bsommerfeld.spellbook.core.error.NetworkException;
import de.bsommerfeld.spellbook.core.error.VersionCheckException;
import de.bsommerfeld.spellbook.sync.download.StreamingDownloader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches the bulk-data listing:
 *
 * <pre>
 * {"data": [{"type": "default_cards", "download_uri": "...", "updated_at": "..."}, ...]}
 * </pre>
 *
 * Every entry must carry all three fields; a listing that doesn't is
 * treated as a broken response rather than silently skipped, since a
 * missing marker would make every local database look stale (or fresh).
 */
@Singleton
public class BulkDataClient {

    private static final Logger LOG = LoggerFactory.getLogger(BulkDataClient.class);

    private final StreamingDownloader downloader;
    private final String listingUrl;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public BulkDataClient(StreamingDownloader downloader, SourcesConfig sources) {
        this(downloader, sources.getBulkDataUrl());
    }

    public BulkDataClient(StreamingDownloader downloader, String listingUrl) {
        this.downloader = downloader;
        this.listingUrl = listingUrl;
    }

    public BulkCatalog fetchCatalog() throws NetworkException, VersionCheckException {
        String body = downloader.toString(listingUrl);
        BulkCatalog catalog = parse(body);
        LOG.debug("Bulk data listing: {}", catalog);
        return catalog;
    }

    BulkCatalog parse(String body) throws VersionCheckException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new VersionCheckException("Bulk data listing is not valid JSON", e);
        }

        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isArray()) {
            throw new VersionCheckException("Bulk data listing has no 'data' array");
        }

        Map<String, RemoteSource> sources = new LinkedHashMap<>();
        for (JsonNode entry : data) {
            String type = requireText(entry, "type");
            String uri = requireText(entry, "download_uri");
            String updatedAt = requireText(entry, "updated_at");
            sources.put(type, new RemoteSource(type, uri, updatedAt));
        }
        return new BulkCatalog(sources);
    }

    private static String requireText(JsonNode entry, String field) throws VersionCheckException {
        JsonNode node = entry.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new VersionCheckException("Bulk data entry is missing '" + field + "': " + entry);
        }
        return node.asText();
    }
}
