package com.coshare.api.wiring;

import com.coshare.application.ports.ConfigPort;
import org.springframework.core.env.Environment;

import java.util.Objects;

/**
 * Spring properties first (application.yml, profiles, env), file config second.
 */
public final class SpringConfigPort implements ConfigPort {

  private final Environment env;
  private final ConfigPort fallback;

  public SpringConfigPort(Environment env, ConfigPort fallback) {
    this.env = Objects.requireNonNull(env, "env");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  @Override
  public String get(String key) {
    return get(key, null);
  }

  @Override
  public String get(String key, String defaultValue) {
    String v = env.getProperty(key);
    if (v != null && !v.isBlank()) return v;
    return fallback.get(key, defaultValue);
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
