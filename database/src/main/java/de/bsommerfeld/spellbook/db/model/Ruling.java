package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Rules clarification for one oracle card; bound and inserted as-is. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Ruling(
        @JsonProperty("oracle_id") String oracleId,
        @JsonProperty("published_at") String publishedAt,
        @JsonProperty("comment") String comment,
        @JsonProperty("source") String source) {
}
