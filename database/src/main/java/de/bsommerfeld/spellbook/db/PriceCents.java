package de.bsommerfeld.spellbook.db;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between upstream decimal price strings and the integer cents
 * stored in the database. Uses {@link BigDecimal} throughout so two-decimal
 * prices survive the round trip exactly.
 */
public final class PriceCents {

    private PriceCents() {
    }

    /**
     * {@code "1.50"} → {@code 150}. Blank or {@code null} input means "no
     * price" and yields {@code null}. Fractions of a cent round half-up.
     *
     * @throws NumberFormatException if the text is not a decimal number
     */
    public static Long toCents(String price) {
        if (price == null || price.isBlank()) {
            return null;
        }
        return new BigDecimal(price.trim())
                .movePointRight(2)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    /** {@code 150} → {@code 1.50}; {@code null} stays {@code null}. */
    public static BigDecimal toDollars(Long cents) {
        return cents == null ? null : BigDecimal.valueOf(cents, 2);
    }
}
