package de.bsommerfeld.spellbook.core.progress;

/**
 * Immutable progress snapshot published by the setup worker.
 *
 * @param stage    stage that produced the snapshot
 * @param fraction overall progress 0.0–1.0 across the whole pipeline
 * @param status   human-readable status line (e.g. "Imported 45,000 cards")
 */
public record ProgressState(SetupStage stage, double fraction, String status) {

    public ProgressState {
        if (stage == null) {
            throw new IllegalArgumentException("stage must not be null");
        }
        fraction = Math.max(0.0, Math.min(1.0, fraction));
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    /** Returns a copy with {@code fraction} raised to at least {@code floor}. */
    ProgressState atLeast(double floor) {
        return fraction >= floor ? this : new ProgressState(stage, floor, status);
    }
}
