package de.bsommerfeld.spellbook.sync.release;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * File attached to a release.
 *
 * @param size size in bytes as reported by the listing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReleaseAsset(
        @JsonProperty("name") String name,
        @JsonProperty("browser_download_url") String downloadUrl,
        @JsonProperty("size") long size) {
}
