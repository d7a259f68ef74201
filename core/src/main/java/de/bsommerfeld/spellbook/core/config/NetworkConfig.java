package de.bsommerfeld.spellbook.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * HTTP timeouts and identification. All timeouts are finite so a stalled
 * remote fails in bounded time.
 */
public class NetworkConfig {

    @JsonProperty("connect-timeout-seconds")
    private long connectTimeoutSeconds = 30;

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 60;

    @JsonProperty("read-timeout-seconds")
    private long readTimeoutSeconds = 300;

    @JsonProperty("user-agent")
    private String userAgent = "SpellbookSetup/1.0";

    public NetworkConfig() {
    }

    public NetworkConfig(long connectTimeoutSeconds, long requestTimeoutSeconds, long readTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    public long getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public long getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    /** Time allowed until response headers arrive. */
    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    /** Longest pause tolerated between two body chunks. */
    public Duration readTimeout() {
        return Duration.ofSeconds(readTimeoutSeconds);
    }
}
