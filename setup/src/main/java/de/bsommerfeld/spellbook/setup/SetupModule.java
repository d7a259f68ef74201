package de.bsommerfeld.spellbook.setup;

import com.google.inject.AbstractModule;
import de.bsommerfeld.spellbook.core.config.ConfigLoader;
import de.bsommerfeld.spellbook.core.config.ImportConfig;
import de.bsommerfeld.spellbook.core.config.NetworkConfig;
import de.bsommerfeld.spellbook.core.config.PathsConfig;
import de.bsommerfeld.spellbook.core.config.SetupConfig;
import de.bsommerfeld.spellbook.core.config.SetupPaths;
import de.bsommerfeld.spellbook.core.config.SourcesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Guice module wiring the setup pipeline. Components bind just-in-time
 * through their {@code @Inject} constructors; this module only provides
 * the configuration they are built from.
 */
public class SetupModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(SetupModule.class);

    private final SetupConfig config;

    /** Uses {@code config.toml} from the app-data directory. */
    public SetupModule() {
        this(loadDefaultConfig());
    }

    public SetupModule(SetupConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(SetupConfig.class).toInstance(config);

        // Sub-configs for components that only need one section
        bind(PathsConfig.class).toInstance(config.getPaths());
        bind(SourcesConfig.class).toInstance(config.getSources());
        bind(NetworkConfig.class).toInstance(config.getNetwork());
        bind(ImportConfig.class).toInstance(config.getImporting());

        SetupPaths paths = config.getPaths().resolve();
        LOG.info("Data directory: {}", paths.dataDirectory());
        bind(SetupPaths.class).toInstance(paths);
    }

    private static SetupConfig loadDefaultConfig() {
        try {
            return ConfigLoader.loadDefault();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load setup configuration", e);
        }
    }
}
