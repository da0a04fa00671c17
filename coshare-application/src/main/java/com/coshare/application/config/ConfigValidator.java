package com.coshare.application.config;

import com.coshare.application.ports.ConfigPort;
import com.coshare.domain.identity.IdentityId;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;

            String v = config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required config: " + k.key());
            }
        }

        String publisher = config.get(ConfigKey.MODULE_PUBLISHER.key(), "");
        if (!publisher.isBlank()) {
            try {
                IdentityId.parse(publisher);
            } catch (IllegalArgumentException e) {
                res.addError(ConfigKey.MODULE_PUBLISHER.key() + " is not a valid identity: " + publisher);
            }
        }

        String timeout = config.get(ConfigKey.STORE_LOCK_TIMEOUT_MS.key(), ConfigKey.STORE_LOCK_TIMEOUT_MS.defaultValue());
        try {
            if (Long.parseLong(timeout.trim()) <= 0) {
                res.addError(ConfigKey.STORE_LOCK_TIMEOUT_MS.key() + " must be positive: " + timeout);
            }
        } catch (NumberFormatException e) {
            res.addError(ConfigKey.STORE_LOCK_TIMEOUT_MS.key() + " must be a number: " + timeout);
        }

        return res;
    }
}
