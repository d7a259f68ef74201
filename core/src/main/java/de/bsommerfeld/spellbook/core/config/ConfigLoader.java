package de.bsommerfeld.spellbook.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.spellbook.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code config.toml} into a {@link SetupConfig}. A missing file is
 * created with the defaults so users have something to edit; unknown keys
 * are ignored so older files keep loading after keys are removed.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /** Loads {@code config.toml} from the platform app-data directory. */
    public static SetupConfig loadDefault() throws IOException {
        Path dir = StorageUtils.ensureDirectory(StorageUtils.getAppDataDir(StorageUtils.APP_NAME));
        return load(dir.resolve("config.toml"));
    }

    public static SetupConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            LOG.info("No configuration at {}, writing defaults", configPath);
            SetupConfig defaults = new SetupConfig();
            write(configPath, defaults);
            return defaults;
        }

        LOG.info("Loading configuration from {}", configPath);
        return MAPPER.readValue(configPath.toFile(), SetupConfig.class);
    }

    public static void write(Path configPath, SetupConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            StorageUtils.ensureDirectory(parent);
        }
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
