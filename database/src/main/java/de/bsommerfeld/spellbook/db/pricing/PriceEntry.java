package de.bsommerfeld.spellbook.db.pricing;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.spellbook.db.PriceCents;

import java.math.BigDecimal;

/**
 * Cached dollar prices of one collection entry, serialized as a two-element
 * array {@code [usd, usdFoil]} with {@code null} for missing prices.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"usd", "usdFoil"})
public record PriceEntry(BigDecimal usd, BigDecimal usdFoil) {

    static PriceEntry fromCents(Long usdCents, Long usdFoilCents) {
        return new PriceEntry(PriceCents.toDollars(usdCents), PriceCents.toDollars(usdFoilCents));
    }
}
