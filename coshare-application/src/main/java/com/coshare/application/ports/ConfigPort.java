package com.coshare.application.ports;

/**
 * Abstraction over configuration.
 * Infrastructure provides implementation (file/env, Spring environment).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    default boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }
}
