package com.coshare.infrastructure.config;

import com.coshare.application.config.ConfigKey;
import com.coshare.application.ports.ConfigPort;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * File + env configuration for standalone use of the protocol services.
 *
 * Load order (low -> high priority):
 *  1) built-in defaults from {@link ConfigKey}
 *  2) config.properties (config dir)
 *  3) .env (config dir, optional; dotted or COSHARE_* key names)
 *  4) OS environment variables, {@code coshare.module.publisher -> COSHARE_MODULE_PUBLISHER}
 */
public final class FileConfigService implements ConfigPort {

    private final Properties props = new Properties();
    private final Path configDir;

    FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = configDir;
        loadDefaults();
        loadAll();
        applyEnvOverrides(env);
    }

    public static FileConfigService defaultFromWorkingDir() throws IOException {
        return fromDirectory(Path.of(System.getProperty("user.dir")).resolve("config"));
    }

    public static FileConfigService fromDirectory(Path configDir) throws IOException {
        return new FileConfigService(Objects.requireNonNull(configDir, "configDir"), System.getenv());
    }

    public Path getConfigDir() {
        return configDir;
    }

    private void loadDefaults() {
        for (ConfigKey k : ConfigKey.values()) {
            if (k.defaultValue() != null) props.setProperty(k.key(), k.defaultValue());
        }
    }

    private void loadAll() throws IOException {
        Path file = configDir.resolve("config.properties");
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file);
                 Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        }

        DotEnv.read(configDir.resolve(".env")).forEach(props::setProperty);
    }

    private void applyEnvOverrides(Map<String, String> env) {
        for (ConfigKey k : ConfigKey.values()) {
            String val = env.get(toEnvKey(k.key()));
            if (val != null) props.setProperty(k.key(), val);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - coshare.module.publisher    -> COSHARE_MODULE_PUBLISHER
     * - coshare.store.lockTimeoutMs -> COSHARE_STORE_LOCK_TIMEOUT_MS
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return s.toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
