package com.gentoro.tldr.config;

import com.gentoro.tldr.exception.ConfigException;
import com.gentoro.tldr.exception.ExceptionUtil;
import org.apache.commons.configuration2.Configuration;

/** Validated accessors shared by the typed settings records. */
final class Settings {
  private Settings() {}

  static String nonBlank(Configuration config, String key, String defaultValue) {
    String value = config.getString(key, defaultValue);
    if (value == null || value.isBlank()) {
      throw new ConfigException("Missing " + key + " configuration");
    }
    return value.trim();
  }

  static int positiveInt(Configuration config, String key, int defaultValue) {
    return intInRange(config, key, defaultValue, 1, Integer.MAX_VALUE);
  }

  static int nonNegativeInt(Configuration config, String key, int defaultValue) {
    return intInRange(config, key, defaultValue, 0, Integer.MAX_VALUE);
  }

  static int intInRange(Configuration config, String key, int defaultValue, int min, int max) {
    int value;
    try {
      value = config.getInt(key, defaultValue);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new ConfigException("Failed to resolve " + key + " configuration", ex));
    }
    if (value < min || value > max) {
      throw new ConfigException(
          "%s must be between %d and %d, got %d".formatted(key, min, max, value));
    }
    return value;
  }

  static long positiveLong(Configuration config, String key, long defaultValue) {
    long value = nonNegativeLong(config, key, defaultValue);
    if (value == 0) {
      throw new ConfigException(key + " must be positive");
    }
    return value;
  }

  static long nonNegativeLong(Configuration config, String key, long defaultValue) {
    long value;
    try {
      value = config.getLong(key, defaultValue);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new ConfigException("Failed to resolve " + key + " configuration", ex));
    }
    if (value < 0) {
      throw new ConfigException(key + " must not be negative, got " + value);
    }
    return value;
  }

  static double nonNegativeDouble(Configuration config, String key, double defaultValue) {
    double value;
    try {
      value = config.getDouble(key, defaultValue);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new ConfigException("Failed to resolve " + key + " configuration", ex));
    }
    if (value < 0 || Double.isNaN(value)) {
      throw new ConfigException(key + " must not be negative, got " + value);
    }
    return value;
  }
}
