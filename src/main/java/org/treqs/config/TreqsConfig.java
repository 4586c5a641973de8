package org.treqs.config;

/**
 * Server settings, read from JSON by {@link org.treqs.infrastructure.util.ConfigLoader}.
 * Fields missing from the file keep these defaults.
 */
public final class TreqsConfig {
    public static final int DEFAULT_PORT = 8080;

    private String key = "treqs";
    private int port = DEFAULT_PORT;
    /** JFR settings name: "default" or "profile". */
    private String captureSettings = "default";
    private long compactIntervalSeconds = 30;
    private int cacheLimit = 64;

    public String key() { return key; }
    public int port() { return port; }
    public String captureSettings() { return captureSettings; }
    public long compactIntervalSeconds() { return compactIntervalSeconds; }
    public int cacheLimit() { return cacheLimit; }

    public TreqsConfig withKey(String key) {
        this.key = key;
        return this;
    }

    public TreqsConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public TreqsConfig withCompactIntervalSeconds(long seconds) {
        this.compactIntervalSeconds = seconds;
        return this;
    }

    /** Fails fast on values the server cannot run with. */
    public TreqsConfig validate() {
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (captureSettings == null || captureSettings.isBlank()) captureSettings = "default";
        if (compactIntervalSeconds <= 0) throw new IllegalArgumentException("compactIntervalSeconds must be > 0");
        if (cacheLimit < 0) throw new IllegalArgumentException("cacheLimit must be >= 0");
        return this;
    }
}
