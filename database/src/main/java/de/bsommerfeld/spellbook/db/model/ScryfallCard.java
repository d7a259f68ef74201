package de.bsommerfeld.spellbook.db.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One printing from the card bulk file. Unknown upstream fields are
 * ignored; everything the {@code cards} table needs is bound here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScryfallCard(
        @JsonProperty("id") String id,
        @JsonProperty("oracle_id") String oracleId,
        @JsonProperty("name") String name,
        @JsonProperty("flavor_name") String flavorName,
        @JsonProperty("layout") String layout,
        @JsonProperty("mana_cost") String manaCost,
        @JsonProperty("cmc") Double cmc,
        @JsonProperty("colors") List<String> colors,
        @JsonProperty("color_identity") List<String> colorIdentity,
        @JsonProperty("type_line") String typeLine,
        @JsonProperty("oracle_text") String oracleText,
        @JsonProperty("flavor_text") String flavorText,
        @JsonProperty("power") String power,
        @JsonProperty("toughness") String toughness,
        @JsonProperty("loyalty") String loyalty,
        @JsonProperty("defense") String defense,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("set") String set,
        @JsonProperty("set_name") String setName,
        @JsonProperty("rarity") String rarity,
        @JsonProperty("collector_number") String collectorNumber,
        @JsonProperty("artist") String artist,
        @JsonProperty("released_at") String releasedAt,
        @JsonProperty("promo") boolean promo,
        @JsonProperty("digital") boolean digital,
        @JsonProperty("edhrec_rank") Integer edhrecRank,
        @JsonProperty("image_uris") ImageUris imageUris,
        @JsonProperty("card_faces") List<CardFace> cardFaces,
        @JsonProperty("prices") Prices prices,
        @JsonProperty("purchase_uris") PurchaseUris purchaseUris,
        @JsonProperty("related_uris") RelatedUris relatedUris,
        @JsonProperty("illustration_id") String illustrationId,
        @JsonProperty("highres_image") boolean highresImage,
        @JsonProperty("border_color") String borderColor,
        @JsonProperty("frame") String frame,
        @JsonProperty("full_art") boolean fullArt,
        @JsonProperty("finishes") List<String> finishes,
        @JsonProperty("legalities") Map<String, String> legalities) {
}
