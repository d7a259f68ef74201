package de.bsommerfeld.spellbook.sync.release;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.spellbook.core.error.NetworkException;
import de.bsommerfeld.spellbook.sync.download.StreamingDownloader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a repository's release listing and returns it sorted newest first.
 */
@Singleton
public class ReleaseClient {

    private static final Logger LOG = LoggerFactory.getLogger(ReleaseClient.class);
    private static final TypeReference<List<Release>> RELEASE_LIST = new TypeReference<>() {
    };

    private final StreamingDownloader downloader;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public ReleaseClient(StreamingDownloader downloader) {
        this.downloader = downloader;
    }

    /**
     * @throws NetworkException if the listing cannot be fetched or is not a
     *                          JSON array of releases
     */
    public List<Release> fetchReleases(GitHubRepository repository) throws NetworkException {
        return fetchReleases(repository.releasesUrl());
    }

    public List<Release> fetchReleases(String listingUrl) throws NetworkException {
        String body = downloader.toString(listingUrl);
        List<Release> releases;
        try {
            releases = new ArrayList<>(mapper.readValue(body, RELEASE_LIST));
        } catch (JsonProcessingException e) {
            throw new NetworkException("Malformed release listing from " + listingUrl, e);
        }
        releases.sort(Release.NEWEST_FIRST);
        LOG.debug("Fetched {} releases from {}", releases.size(), listingUrl);
        return releases;
    }
}
