package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the MTGJson set list, used to enrich set rows with block and
 * size information the primary set endpoint does not provide.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SetMetadata(
        @JsonProperty("code") String code,
        @JsonProperty("block") String block,
        @JsonProperty("baseSetSize") Integer baseSetSize,
        @JsonProperty("totalSetSize") Integer totalSetSize,
        @JsonProperty("keyruneCode") String keyruneCode) {

    public static final SetMetadata NONE = new SetMetadata(null, null, null, null, null);
}
