package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decimal price strings as delivered upstream, e.g. {@code "1.50"}, or
 * {@code null} when a printing has no market price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Prices(
        @JsonProperty("usd") String usd,
        @JsonProperty("usd_foil") String usdFoil,
        @JsonProperty("eur") String eur,
        @JsonProperty("eur_foil") String eurFoil) {

    public static final Prices EMPTY = new Prices(null, null, null, null);
}
