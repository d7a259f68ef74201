package de.bsommerfeld.spellbook.db.model;

import java.util.Locale;

/** One row of the {@code sets} table. Codes are stored lower-case. */
public record SetRow(
        String code,
        String name,
        String setType,
        String releaseDate,
        Integer cardCount,
        String iconSvgUri,
        String block,
        Integer baseSetSize,
        Integer totalSetSize,
        boolean onlineOnly,
        boolean foilOnly,
        String keyruneCode) {

    public static SetRow of(ScryfallSet set, SetMetadata extra) {
        if (set.code() == null || set.code().isBlank() || set.name() == null) {
            throw new IllegalArgumentException("Set record without code or name");
        }
        return new SetRow(
                set.code().toLowerCase(Locale.ROOT),
                set.name(),
                set.setType(),
                set.releasedAt(),
                set.cardCount(),
                set.iconSvgUri(),
                extra.block(),
                extra.baseSetSize(),
                extra.totalSetSize(),
                set.digital(),
                set.foilOnly(),
                extra.keyruneCode());
    }
}
