package org.treqs.infrastructure.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treqs.config.TreqsConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public final class ConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Gson gson = new GsonBuilder().create();

    public static final String KEY_PROPERTY = "treqs.key";
    public static final String PORT_PROPERTY = "treqs.port";

    private ConfigLoader() {}

    /** Reads the file, or returns defaults when it is absent or malformed. */
    public static TreqsConfig loadOrDefault(Path file) {
        if (file == null || !Files.exists(file)) {
            LOG.info("No config file at {}, using defaults", file);
            return new TreqsConfig();
        }
        try {
            String s = Files.readString(file, StandardCharsets.UTF_8);
            TreqsConfig cfg = gson.fromJson(s, TreqsConfig.class);
            return cfg == null ? new TreqsConfig() : cfg;
        } catch (IOException | JsonParseException e) {
            LOG.warn("Could not read config {}, using defaults: {}", file, e.getMessage());
            return new TreqsConfig();
        }
    }

    /** {@code treqs.key} and {@code treqs.port} win over the file. */
    public static TreqsConfig applyOverrides(TreqsConfig cfg, Properties props) {
        String key = props.getProperty(KEY_PROPERTY);
        if (key != null) cfg.withKey(key);
        String port = props.getProperty(PORT_PROPERTY);
        if (port != null) {
            try {
                cfg.withPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid " + PORT_PROPERTY + ": " + port, e);
            }
        }
        return cfg.validate();
    }
}
