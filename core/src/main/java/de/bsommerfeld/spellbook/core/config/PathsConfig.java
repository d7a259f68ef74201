package de.bsommerfeld.spellbook.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.spellbook.core.util.StorageUtils;

import java.nio.file.Path;

/**
 * File locations. Relative file names resolve against the data directory;
 * a blank data directory means the platform app-data directory.
 */
public class PathsConfig {

    @JsonProperty("data-directory")
    private String dataDirectory = "";

    @JsonProperty("card-database")
    private String cardDatabase = "cards.sqlite";

    @JsonProperty("combo-database")
    private String comboDatabase = "combos.sqlite";

    @JsonProperty("gameplay-database")
    private String gameplayDatabase = "gameplay.duckdb";

    @JsonProperty("collection-database")
    private String collectionDatabase = "user.sqlite";

    @JsonProperty("price-cache")
    private String priceCache = "price_cache.json";

    public String getDataDirectory() {
        return dataDirectory;
    }

    public String getCardDatabase() {
        return cardDatabase;
    }

    public String getComboDatabase() {
        return comboDatabase;
    }

    public String getGameplayDatabase() {
        return gameplayDatabase;
    }

    public String getCollectionDatabase() {
        return collectionDatabase;
    }

    public String getPriceCache() {
        return priceCache;
    }

    /** Resolves every configured location into absolute paths. */
    public SetupPaths resolve() {
        Path base = dataDirectory == null || dataDirectory.isBlank()
                ? StorageUtils.getAppDataDir(StorageUtils.APP_NAME)
                : Path.of(dataDirectory);
        base = base.toAbsolutePath().normalize();
        return new SetupPaths(
                base,
                base.resolve(cardDatabase),
                base.resolve(comboDatabase),
                base.resolve(gameplayDatabase),
                base.resolve(collectionDatabase),
                base.resolve(priceCache));
    }
}
