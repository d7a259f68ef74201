package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageUris(
        @JsonProperty("small") String small,
        @JsonProperty("normal") String normal,
        @JsonProperty("large") String large,
        @JsonProperty("png") String png,
        @JsonProperty("art_crop") String artCrop,
        @JsonProperty("border_crop") String borderCrop) {

    public static final ImageUris EMPTY = new ImageUris(null, null, null, null, null, null);
}
