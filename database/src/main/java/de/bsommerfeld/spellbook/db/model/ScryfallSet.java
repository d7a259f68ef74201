package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScryfallSet(
        @JsonProperty("code") String code,
        @JsonProperty("name") String name,
        @JsonProperty("set_type") String setType,
        @JsonProperty("released_at") String releasedAt,
        @JsonProperty("card_count") Integer cardCount,
        @JsonProperty("icon_svg_uri") String iconSvgUri,
        @JsonProperty("digital") boolean digital,
        @JsonProperty("foil_only") boolean foilOnly) {
}
