package de.bsommerfeld.spellbook.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the platform's application data directory. Databases, the price
 * cache and {@code config.toml} all live below it unless the configuration
 * points somewhere else.
 *
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "spellbook";

    private StorageUtils() {
    }

    /**
     * Returns the data directory for {@code appName}. The directory is not
     * created; use {@link #ensureDirectory(Path)} before writing into it.
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName)
                : Paths.get(home, ".local", "share", appName);
    }

    /**
     * Creates {@code dir} and its parents if missing and returns it.
     *
     * @throws IOException if the directory cannot be created
     */
    public static Path ensureDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
        }
        return dir;
    }
}
