package de.bsommerfeld.spellbook.db;

/**
 * Phases of a card database build in the only order they may happen:
 *
 * <pre>
 * INIT → SCHEMA_CREATED → SOURCE_IMPORTED (once per source) → INDEXES_BUILT
 *      → SEARCH_INDEX_BUILT → VERSION_STAMPED → DONE
 * </pre>
 *
 * Indexes are built only after all data is in, and the search index only
 * after the regular indexes. The version stamp comes last so a build that
 * stops anywhere earlier leaves a file the freshness check treats as stale.
 */
public enum BuildPhase {

    INIT,
    SCHEMA_CREATED,
    SOURCE_IMPORTED,
    INDEXES_BUILT,
    SEARCH_INDEX_BUILT,
    VERSION_STAMPED,
    DONE;

    /** {@code SOURCE_IMPORTED} repeats; every other phase advances by exactly one. */
    public boolean canAdvanceTo(BuildPhase next) {
        if (next == SOURCE_IMPORTED) {
            return this == SCHEMA_CREATED || this == SOURCE_IMPORTED;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
