package de.bsommerfeld.spellbook.core.progress;

/**
 * Pipeline stages in execution order. Each stage owns a fixed window of the
 * overall progress range; a stage-local ratio of 0..1 maps into that window,
 * so progress across the whole pipeline only ever moves forward even though
 * every stage counts from zero.
 *
 * <p>
 * Stages that are skipped (e.g. every build stage when the database is
 * fresh) simply never report; the next stage starts further along.
 */
public enum SetupStage {

    CHECKING(0.00, 0.04, "Checking for updates"),
    DOWNLOADING_CARDS(0.04, 0.40, "Downloading cards"),
    DOWNLOADING_SETS(0.40, 0.42, "Downloading sets"),
    DOWNLOADING_RULINGS(0.42, 0.47, "Downloading rulings"),
    DOWNLOADING_SET_METADATA(0.47, 0.49, "Downloading set metadata"),
    CREATING_SCHEMA(0.49, 0.50, "Creating database schema"),
    IMPORTING_SETS(0.50, 0.51, "Importing sets"),
    IMPORTING_CARDS(0.51, 0.76, "Importing cards"),
    IMPORTING_RULINGS(0.76, 0.80, "Importing rulings"),
    CREATING_INDEXES(0.80, 0.83, "Creating indexes"),
    BUILDING_SEARCH_INDEX(0.83, 0.86, "Building search index"),
    STAMPING_VERSION(0.86, 0.87, "Finalizing"),
    SYNCING_COMBOS(0.87, 0.92, "Syncing combo database"),
    SYNCING_GAMEPLAY(0.92, 0.95, "Syncing gameplay statistics"),
    CACHING_PRICES(0.95, 0.99, "Caching collection prices"),
    COMPLETE(1.00, 1.00, "Complete"),
    ERROR(0.00, 0.00, "Failed");

    private final double start;
    private final double end;
    private final String label;

    SetupStage(double start, double end, String label) {
        this.start = start;
        this.end = end;
        this.label = label;
    }

    /**
     * Maps a stage-local ratio into the overall range. Ratios outside 0..1
     * are clamped.
     */
    public double at(double localRatio) {
        double clamped = Math.max(0.0, Math.min(1.0, localRatio));
        return start + (end - start) * clamped;
    }

    public double start() {
        return start;
    }

    public double end() {
        return end;
    }

    public String label() {
        return label;
    }

    /** Terminal stages close the progress channel. */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
