package de.bsommerfeld.spellbook.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ImportConfig {

    public static final int DEFAULT_BATCH_SIZE = 5000;

    @JsonProperty("batch-size")
    private int batchSize = DEFAULT_BATCH_SIZE;

    public int getBatchSize() {
        return batchSize;
    }
}
