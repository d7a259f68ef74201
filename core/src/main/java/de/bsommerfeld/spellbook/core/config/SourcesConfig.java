package de.bsommerfeld.spellbook.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Remote endpoints. The bulk-data listing provides the download locations
 * and freshness markers for card and ruling data; sets come from a plain
 * endpoint without a marker.
 */
public class SourcesConfig {

    @JsonProperty("bulk-data-url")
    private String bulkDataUrl = "https://api.scryfall.com/bulk-data";

    @JsonProperty("card-bulk-type")
    private String cardBulkType = "default_cards";

    @JsonProperty("ruling-bulk-type")
    private String rulingBulkType = "rulings";

    @JsonProperty("sets-url")
    private String setsUrl = "https://api.scryfall.com/sets";

    @JsonProperty("set-metadata-url")
    private String setMetadataUrl = "https://mtgjson.com/api/v5/SetList.json";

    @JsonProperty("combo-repository")
    private String comboRepository = "AImaginationLab/magic-the-gathering-toolkit";

    @JsonProperty("combo-asset")
    private String comboAsset = "combos.sqlite";

    @JsonProperty("gameplay-repository")
    private String gameplayRepository = "AImaginationLab/magic-the-gathering-toolkit";

    @JsonProperty("gameplay-asset")
    private String gameplayAsset = "gameplay.duckdb";

    public String getBulkDataUrl() {
        return bulkDataUrl;
    }

    public String getCardBulkType() {
        return cardBulkType;
    }

    public String getRulingBulkType() {
        return rulingBulkType;
    }

    public String getSetsUrl() {
        return setsUrl;
    }

    /** Blank disables set enrichment. */
    public String getSetMetadataUrl() {
        return setMetadataUrl;
    }

    /** {@code owner/repo} slug of the repository publishing the combo artifact. */
    public String getComboRepository() {
        return comboRepository;
    }

    /** Uncompressed asset name; the gzip variant is this name plus {@code .gz}. */
    public String getComboAsset() {
        return comboAsset;
    }

    public String getGameplayRepository() {
        return gameplayRepository;
    }

    /** Uncompressed name of the gameplay statistics asset. */
    public String getGameplayAsset() {
        return gameplayAsset;
    }
}
