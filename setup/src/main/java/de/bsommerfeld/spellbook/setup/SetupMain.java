package de.bsommerfeld.spellbook.setup;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.spellbook.core.progress.ProgressState;
import de.bsommerfeld.spellbook.core.progress.SetupStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.CompletionException;

/**
 * Command-line entry point. Runs one setup and logs its progress.
 *
 * <p>
 * {@code --force} rebuilds the card database even if it is current. Exits
 * with status 1 if the run failed.
 */
public final class SetupMain {

    private static final Logger LOG = LoggerFactory.getLogger(SetupMain.class);

    private SetupMain() {
    }

    public static void main(String[] args) {
        boolean force = Arrays.asList(args).contains("--force");

        Injector injector = Guice.createInjector(new SetupModule());
        try (SetupManager manager = injector.getInstance(SetupManager.class)) {
            SetupRun run = manager.start(force);
            logProgress(run);

            SetupReport report = run.result().join();
            LOG.info("Done in {}s: {}", report.elapsed().toSeconds(), report.summary());
        } catch (CompletionException e) {
            LOG.error("Setup failed", e.getCause());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while waiting for setup");
            System.exit(1);
        }
    }

    /**
     * Logs each stage once on entry at INFO and every further snapshot at
     * DEBUG, until the terminal snapshot arrives.
     */
    private static void logProgress(SetupRun run) throws InterruptedException {
        SetupStage current = null;
        while (true) {
            ProgressState state = run.progress().take();
            if (state.stage() != current) {
                current = state.stage();
                LOG.info("[{}%] {}", Math.round(state.fraction() * 100), state.status());
            } else {
                LOG.debug("[{}%] {}", Math.round(state.fraction() * 100), state.status());
            }
            if (state.isTerminal()) {
                return;
            }
        }
    }
}
