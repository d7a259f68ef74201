package de.bsommerfeld.spellbook.db.imports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.spellbook.db.PriceCents;
import de.bsommerfeld.spellbook.db.model.CardFace;
import de.bsommerfeld.spellbook.db.model.CardRow;
import de.bsommerfeld.spellbook.db.model.ImageUris;
import de.bsommerfeld.spellbook.db.model.Prices;
import de.bsommerfeld.spellbook.db.model.PurchaseUris;
import de.bsommerfeld.spellbook.db.model.RelatedUris;
import de.bsommerfeld.spellbook.db.model.ScryfallCard;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps a bound {@link ScryfallCard} to the row written into {@code cards}.
 *
 * <ul>
 * <li>Images come from the card itself, or from its first face for
 * multi-faced layouts that carry images per face.</li>
 * <li>Prices become integer cents via {@link PriceCents}.</li>
 * <li>Lists and maps are serialized to JSON text; absent lists become
 * {@code []} and absent legalities {@code {}} so generated columns always
 * evaluate.</li>
 * </ul>
 *
 * Records without an id, name, set or collector number are rejected with
 * {@link IllegalArgumentException}; the importer turns that into a parse
 * failure for the whole pass.
 */
public class CardTransformer implements Function<ScryfallCard, CardRow> {

    private static final Set<String> TOKEN_LAYOUTS = Set.of("token", "double_faced_token", "emblem");

    static final int ART_BORDERLESS = 0;
    static final int ART_FULL = 1;
    static final int ART_REGULAR = 2;

    private final ObjectMapper mapper;

    public CardTransformer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public CardRow apply(ScryfallCard card) {
        requirePresent(card.id(), "id", card);
        requirePresent(card.name(), "name", card);
        requirePresent(card.set(), "set", card);
        requirePresent(card.collectorNumber(), "collector_number", card);

        Prices prices = card.prices() != null ? card.prices() : Prices.EMPTY;
        String layout = card.layout() != null ? card.layout() : "";

        return new CardRow(
                card.id(),
                card.oracleId(),
                card.name(),
                card.flavorName(),
                layout,
                card.manaCost(),
                card.cmc(),
                json(listOrEmpty(card.colors())),
                json(listOrEmpty(card.colorIdentity())),
                card.typeLine(),
                card.oracleText(),
                card.flavorText(),
                card.power(),
                card.toughness(),
                card.loyalty(),
                card.defense(),
                json(listOrEmpty(card.keywords())),
                card.set(),
                card.setName(),
                card.rarity(),
                card.collectorNumber(),
                card.artist(),
                card.releasedAt(),
                TOKEN_LAYOUTS.contains(layout),
                card.promo(),
                card.digital(),
                card.edhrecRank(),
                resolveImages(card),
                PriceCents.toCents(prices.usd()),
                PriceCents.toCents(prices.usdFoil()),
                PriceCents.toCents(prices.eur()),
                PriceCents.toCents(prices.eurFoil()),
                card.purchaseUris() != null ? card.purchaseUris() : PurchaseUris.EMPTY,
                card.relatedUris() != null ? card.relatedUris() : RelatedUris.EMPTY,
                card.illustrationId(),
                card.highresImage(),
                card.borderColor(),
                card.frame(),
                card.fullArt(),
                artPriority(card),
                json(listOrEmpty(card.finishes())),
                json(card.legalities() != null ? card.legalities() : Map.of()));
    }

    static ImageUris resolveImages(ScryfallCard card) {
        if (card.imageUris() != null) {
            return card.imageUris();
        }
        List<CardFace> faces = card.cardFaces();
        if (faces != null && !faces.isEmpty() && faces.get(0).imageUris() != null) {
            return faces.get(0).imageUris();
        }
        return ImageUris.EMPTY;
    }

    /** Lower sorts first when picking the showcase printing of an illustration. */
    static int artPriority(ScryfallCard card) {
        if ("borderless".equals(card.borderColor())) {
            return ART_BORDERLESS;
        }
        return card.fullArt() ? ART_FULL : ART_REGULAR;
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value, e);
        }
    }

    private static List<String> listOrEmpty(List<String> list) {
        return list != null ? list : List.of();
    }

    private static void requirePresent(String value, String field, ScryfallCard card) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Card record without '" + field + "'"
                    + (card.id() != null ? " (id " + card.id() + ")" : ""));
        }
    }
}
