package com.coshare.application.config;

import com.coshare.application.ports.ConfigPort;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator();

    @Test
    void validWhenPublisherSet() {
        ConfigValidationResult res = validator.validate(config(Map.of(ConfigKey.MODULE_PUBLISHER.key(), "0xc0ffee")));

        assertThat(res.isValid()).isTrue();
        assertThat(res.errors()).isEmpty();
    }

    @Test
    void missingPublisherIsReported() {
        ConfigValidationResult res = validator.validate(config(Map.of()));

        assertThat(res.isValid()).isFalse();
        assertThat(res.errors()).containsExactly("Missing required config: coshare.module.publisher");
        assertThatThrownBy(res::throwIfInvalid)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("coshare.module.publisher");
    }

    @Test
    void malformedPublisherIsReported() {
        ConfigValidationResult res = validator.validate(config(Map.of(ConfigKey.MODULE_PUBLISHER.key(), "not-hex")));

        assertThat(res.errors()).singleElement().asString().contains("not a valid identity");
    }

    @Test
    void lockTimeoutMustBePositiveNumber() {
        Map<String, String> values = new HashMap<>();
        values.put(ConfigKey.MODULE_PUBLISHER.key(), "0x1");
        values.put(ConfigKey.STORE_LOCK_TIMEOUT_MS.key(), "0");
        assertThat(validator.validate(config(values)).errors()).singleElement().asString().contains("must be positive");

        values.put(ConfigKey.STORE_LOCK_TIMEOUT_MS.key(), "soon");
        assertThat(validator.validate(config(values)).errors()).singleElement().asString().contains("must be a number");
    }

    private static ConfigPort config(Map<String, String> values) {
        return new ConfigPort() {
            @Override
            public String get(String key) {
                return values.get(key);
            }

            @Override
            public String get(String key, String defaultValue) {
                return values.getOrDefault(key, defaultValue);
            }

            @Override
            public int getInt(String key, int defaultValue) {
                String v = values.get(key);
                return v == null ? defaultValue : Integer.parseInt(v.trim());
            }
        };
    }
}
