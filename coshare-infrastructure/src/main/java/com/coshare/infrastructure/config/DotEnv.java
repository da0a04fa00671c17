package com.coshare.infrastructure.config;

import com.coshare.application.config.ConfigKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads coshare settings from a {@code .env} file.
 *
 * Either spelling of a key is accepted, {@code COSHARE_MODULE_PUBLISHER=0x..} or
 * {@code coshare.module.publisher=0x..}; results are keyed by {@link ConfigKey#key()}.
 * Unknown keys are skipped. Values may be single- or double-quoted; unquoted values end
 * at a {@code " #"} comment.
 */
final class DotEnv {

    private static final Logger log = LoggerFactory.getLogger(DotEnv.class);

    private static final Map<String, ConfigKey> KNOWN = new HashMap<>();

    static {
        for (ConfigKey k : ConfigKey.values()) {
            KNOWN.put(k.key(), k);
            KNOWN.put(FileConfigService.toEnvKey(k.key()), k);
        }
    }

    private DotEnv() {}

    static Map<String, String> read(Path envFile) throws IOException {
        if (!Files.isRegularFile(envFile)) return Map.of();
        return parse(Files.readAllLines(envFile, StandardCharsets.UTF_8), envFile.getFileName().toString());
    }

    static Map<String, String> parse(List<String> lines, String source) {
        Map<String, String> out = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring(7).stripLeading();

            int eq = line.indexOf('=');
            if (eq <= 0) {
                log.warn("[CONFIG] {}:{} ignored, expected KEY=value", source, lineNo);
                continue;
            }

            String name = line.substring(0, eq).strip();
            ConfigKey key = KNOWN.get(name);
            if (key == null) {
                log.debug("[CONFIG] {}:{} skipped unknown key {}", source, lineNo, name);
                continue;
            }
            out.put(key.key(), value(line.substring(eq + 1).strip()));
        }
        return out;
    }

    private static String value(String v) {
        if (v.length() >= 2 && v.charAt(0) == '\'' && v.endsWith("'")) {
            return v.substring(1, v.length() - 1);
        }
        if (v.length() >= 2 && v.charAt(0) == '"' && v.endsWith("\"")) {
            return v.substring(1, v.length() - 1).replace("\\\"", "\"").replace("\\n", "\n");
        }
        int comment = v.indexOf(" #");
        return comment < 0 ? v : v.substring(0, comment).stripTrailing();
    }
}
