package com.coshare.application.config;

/**
 * Known configuration keys for coshare.
 */
public enum ConfigKey {
    MODULE_PUBLISHER("coshare.module.publisher", false, null),

    AUDIT_LOG_ENABLED("coshare.audit.log.enabled", true, "true"),
    AUDIT_METRICS_ENABLED("coshare.audit.metrics.enabled", true, "true"),

    // how long a unit of work waits for the store before giving up
    STORE_LOCK_TIMEOUT_MS("coshare.store.lockTimeoutMs", true, "5000");

    private final String key;
    private final boolean optional;
    private final String defaultValue;

    ConfigKey(String key, boolean optional, String defaultValue) {
        this.key = key;
        this.optional = optional;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }
    public boolean isOptional() { return optional; }
    public String defaultValue() { return defaultValue; }
}
