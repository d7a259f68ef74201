package de.bsommerfeld.spellbook.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Producer-side facade over a {@link ProgressChannel}. Components report in
 * stage-local terms; the reporter maps them into the overall range.
 */
public final class ProgressReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressReporter.class);

    private final ProgressChannel channel;

    public ProgressReporter(ProgressChannel channel) {
        this.channel = channel;
    }

    /** Reporter whose snapshots go to a private channel nobody reads. */
    public static ProgressReporter discarding() {
        return new ProgressReporter(new ProgressChannel(1));
    }

    /** Announces the start of a stage using its default label. */
    public void enter(SetupStage stage) {
        report(stage, 0.0, stage.label() + "...");
    }

    public void report(SetupStage stage, double localRatio, String status) {
        ProgressState published = channel.publish(new ProgressState(stage, stage.at(localRatio), status));
        if (published != null && LOG.isTraceEnabled()) {
            LOG.trace("[{}] {} ({})", stage, status, String.format("%.3f", published.fraction()));
        }
    }

    public void finish(SetupStage stage, String status) {
        report(stage, 1.0, status);
    }

    /**
     * Publishes the terminal error snapshot. The fraction stays where the
     * pipeline stopped.
     */
    public void fail(String message) {
        channel.publish(new ProgressState(SetupStage.ERROR, 0.0, message));
    }

    public void complete(String message) {
        channel.publish(new ProgressState(SetupStage.COMPLETE, 1.0, message));
    }

    public ProgressChannel channel() {
        return channel;
    }
}
