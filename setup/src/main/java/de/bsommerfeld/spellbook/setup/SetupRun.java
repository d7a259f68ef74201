package de.bsommerfeld.spellbook.setup;

import de.bsommerfeld.spellbook.core.progress.ProgressChannel;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a running setup. Progress snapshots arrive on {@code progress}
 * until a terminal snapshot closes it; {@code result} completes with the
 * report or with the exception that aborted the run.
 */
public record SetupRun(ProgressChannel progress, CompletableFuture<SetupReport> result) {
}
