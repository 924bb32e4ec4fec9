package io.fullerstack.recurrent.config;

import java.time.Duration;
import java.util.*;

/**
 * Hierarchical scheduler configuration using ResourceBundle (zero dependencies).
 *
 * <p>Keys live under the {@code scheduler.} prefix. A scoped configuration (one per
 * scheduler name) resolves a key through this fallback chain:
 * <ol>
 *   <li>{@code scheduler.{name}.{key}} (scheduler-specific)</li>
 *   <li>{@code scheduler.{key}} (global default)</li>
 * </ol>
 * At each level a JVM system property with the same full key takes precedence over the
 * property file.
 *
 * <p><strong>Example property file (recurrent.properties):</strong>
 * <pre>
 * scheduler.interval-ms=1000
 * scheduler.daemon-threads=true
 *
 * # cache-refresh scheduler fires every 30s, signals throttled to one per 5s
 * scheduler.cache-refresh.interval-ms=30000
 * scheduler.cache-refresh.throttle-ms=5000
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig config = HierarchicalConfig.forScheduler("cache-refresh");
 * Duration interval = config.getDuration("interval-ms", Duration.ofSeconds(1));
 * // → 30s
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <pre>
 * java -Dscheduler.cache-refresh.interval-ms=60000 -jar app.jar
 * </pre>
 */
public class HierarchicalConfig {

  /**
   * Base name of the default bundle, {@code recurrent.properties} on the classpath.
   */
  public static final String DEFAULT_BUNDLE = "recurrent";

  static final String PREFIX = "scheduler.";

  private final ResourceBundle bundle;
  private final String scope;    // null for global
  private final String context;  // For debugging/logging

  private HierarchicalConfig(ResourceBundle bundle, String scope, String context) {
    this.bundle = bundle;
    this.scope = scope;
    this.context = context;
  }

  /**
   * Get global configuration (recurrent.properties).
   *
   * @return Global configuration
   */
  public static HierarchicalConfig global() {
    return new HierarchicalConfig(load(DEFAULT_BUNDLE), null, "global");
  }

  /**
   * Get scheduler-specific configuration from recurrent.properties.
   *
   * @param schedulerName Scheduler name (e.g., "cache-refresh")
   * @return Scheduler-specific configuration, falling back to global keys
   */
  public static HierarchicalConfig forScheduler(String schedulerName) {
    return fromBundle(DEFAULT_BUNDLE, schedulerName);
  }

  /**
   * Get configuration from an arbitrary bundle.
   *
   * @param baseName      ResourceBundle base name
   * @param schedulerName Scheduler name, or null for the global scope
   * @return Configuration backed by the named bundle
   */
  public static HierarchicalConfig fromBundle(String baseName, String schedulerName) {
    Objects.requireNonNull(baseName, "baseName cannot be null");
    if (schedulerName == null) {
      return new HierarchicalConfig(load(baseName), null, "global:" + baseName);
    }
    if (schedulerName.isBlank()) {
      throw new IllegalArgumentException("schedulerName cannot be blank");
    }
    return new HierarchicalConfig(load(baseName), schedulerName, "scheduler:" + schedulerName);
  }

  private static ResourceBundle load(String baseName) {
    try {
      return ResourceBundle.getBundle(baseName, Locale.ROOT);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("Missing configuration bundle '" + baseName + "'", e);
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get a millisecond value as a Duration.
   *
   * @param key Property key without the {@code scheduler.} prefix (conventionally ending in {@code -ms})
   * @param defaultValue Default if not found or not a number
   * @return Property value as Duration or default
   */
  public Duration getDuration(String key, Duration defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get an optional millisecond value. Absent, zero and negative values are all empty.
   *
   * @param key Property key
   * @return Positive Duration, or empty
   * @throws ConfigurationException if the value is present but not a number
   */
  public Optional<Duration> getOptionalDuration(String key) {
    String value = lookup(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    long millis;
    try {
      millis = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid millisecond value for key '" + key + "': " + value, e
      );
    }
    return millis > 0 ? Optional.of(Duration.ofMillis(millis)) : Optional.empty();
  }

  /**
   * Get boolean value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "scheduler:cache-refresh")
   */
  public String context() {
    return context;
  }

  /**
   * @return Scheduler name of this scope, empty for the global scope
   */
  public Optional<String> scope() {
    return Optional.ofNullable(scope);
  }

  private String lookup(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    if (scope != null) {
      String scoped = resolve(PREFIX + scope + "." + key);
      if (scoped != null) {
        return scoped;
      }
    }
    return resolve(PREFIX + key);
  }

  private String resolve(String fullKey) {
    // System property override
    String sysProp = System.getProperty(fullKey);
    if (sysProp != null) {
      return sysProp;
    }
    return bundle.containsKey(fullKey) ? bundle.getString(fullKey) : null;
  }

  @Override
  public String toString() {
    return "HierarchicalConfig[context=" + context + "]";
  }
}
