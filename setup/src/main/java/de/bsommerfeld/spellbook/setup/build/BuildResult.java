package de.bsommerfeld.spellbook.setup.build;

import java.time.Duration;

/**
 * What {@link DatabaseBuildOrchestrator#run} did. Counts are zero when the
 * database was already current.
 */
public record BuildResult(boolean rebuilt, String freshnessMarker, long cards, long sets, long rulings,
        Duration elapsed) {

    static BuildResult upToDate(String freshnessMarker, Duration elapsed) {
        return new BuildResult(false, freshnessMarker, 0, 0, 0, elapsed);
    }
}
