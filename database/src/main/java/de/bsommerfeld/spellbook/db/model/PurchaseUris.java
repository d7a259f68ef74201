package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PurchaseUris(
        @JsonProperty("tcgplayer") String tcgplayer,
        @JsonProperty("cardmarket") String cardmarket,
        @JsonProperty("cardhoarder") String cardhoarder) {

    public static final PurchaseUris EMPTY = new PurchaseUris(null, null, null);
}
