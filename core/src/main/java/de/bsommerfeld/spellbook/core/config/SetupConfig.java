package de.bsommerfeld.spellbook.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one nested POJO; field
 * initializers are the defaults written on first start.
 */
public class SetupConfig {

    @JsonProperty("paths")
    private PathsConfig paths = new PathsConfig();

    @JsonProperty("sources")
    private SourcesConfig sources = new SourcesConfig();

    @JsonProperty("network")
    private NetworkConfig network = new NetworkConfig();

    @JsonProperty("import")
    private ImportConfig importing = new ImportConfig();

    public PathsConfig getPaths() {
        return paths;
    }

    public SourcesConfig getSources() {
        return sources;
    }

    public NetworkConfig getNetwork() {
        return network;
    }

    public ImportConfig getImporting() {
        return importing;
    }
}
