package de.bsommerfeld.spellbook.sync.release;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One entry of a repository's release listing. Timestamps are kept as the
 * ISO-8601 strings GitHub sends; they are fixed-width UTC and order
 * lexicographically.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Release(
        @JsonProperty("tag_name") String tagName,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("published_at") String publishedAt,
        @JsonProperty("assets") List<ReleaseAsset> assets) {

    /** Newest first, by {@link #freshnessMarker()}. */
    public static final Comparator<Release> NEWEST_FIRST =
            Comparator.comparing(Release::freshnessMarker).reversed();

    public Release {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }

    /**
     * {@code updated_at}, or {@code published_at} for releases that were
     * never edited. Empty when neither is present, which sorts last.
     */
    public String freshnessMarker() {
        if (updatedAt != null && !updatedAt.isBlank()) return updatedAt;
        if (publishedAt != null && !publishedAt.isBlank()) return publishedAt;
        return "";
    }

    public Optional<ReleaseAsset> asset(String name) {
        return assets.stream().filter(a -> name.equals(a.name())).findFirst();
    }
}
