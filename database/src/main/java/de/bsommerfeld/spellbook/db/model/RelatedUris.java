package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RelatedUris(
        @JsonProperty("edhrec") String edhrec,
        @JsonProperty("gatherer") String gatherer) {

    public static final RelatedUris EMPTY = new RelatedUris(null, null);
}
