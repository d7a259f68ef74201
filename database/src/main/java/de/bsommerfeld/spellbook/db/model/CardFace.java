package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One face of a multi-faced card. Only the fields the import reads are
 * bound.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CardFace(
        @JsonProperty("name") String name,
        @JsonProperty("mana_cost") String manaCost,
        @JsonProperty("type_line") String typeLine,
        @JsonProperty("oracle_text") String oracleText,
        @JsonProperty("image_uris") ImageUris imageUris) {
}
