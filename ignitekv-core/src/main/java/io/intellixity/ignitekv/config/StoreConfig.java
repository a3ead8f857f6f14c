package io.intellixity.ignitekv.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Store configuration.\n
 *
 * {@code keySize}/{@code valueSize} are the widths of the backing {@code k}/{@code v} columns, in
 * characters of the encoded form. The hex codec spends two characters per byte, so a key holds at
 * most {@code keySize / 2} bytes and a value at most {@code valueSize / 2}. {@code location} may be a
 * prefix completed by the override given to {@code open}.
 */
public record StoreConfig(
    String location,
    int keySize,
    int valueSize,
    String username,
    String password,
    int maxPoolSize,
    Duration pollInterval,
    Duration awaitTimeout,
    int maxAttempts,
    PutStrategy putStrategy
) {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
  public static final Duration DEFAULT_AWAIT_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_POOL_SIZE = 10;

  public StoreConfig {
    Objects.requireNonNull(location, "location");
    if (keySize <= 0) throw new IllegalArgumentException("keySize must be > 0");
    if (valueSize <= 0) throw new IllegalArgumentException("valueSize must be > 0");
    if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
    pollInterval = (pollInterval == null) ? DEFAULT_POLL_INTERVAL : pollInterval;
    awaitTimeout = (awaitTimeout == null) ? DEFAULT_AWAIT_TIMEOUT : awaitTimeout;
    if (pollInterval.isNegative() || pollInterval.isZero()) throw new IllegalArgumentException("pollInterval must be > 0");
    if (awaitTimeout.isNegative()) throw new IllegalArgumentException("awaitTimeout must be >= 0");
    putStrategy = (putStrategy == null) ? PutStrategy.MERGE : putStrategy;
  }

  public static StoreConfig of(String location, int keySize, int valueSize) {
    return new StoreConfig(location, keySize, valueSize, null, null,
        DEFAULT_MAX_POOL_SIZE, DEFAULT_POLL_INTERVAL, DEFAULT_AWAIT_TIMEOUT, DEFAULT_MAX_ATTEMPTS, PutStrategy.MERGE);
  }

  public StoreConfig withCredentials(String username, String password) {
    return new StoreConfig(location, keySize, valueSize, username, password,
        maxPoolSize, pollInterval, awaitTimeout, maxAttempts, putStrategy);
  }

  public StoreConfig withRetry(int maxAttempts, Duration pollInterval, Duration awaitTimeout) {
    return new StoreConfig(location, keySize, valueSize, username, password,
        maxPoolSize, pollInterval, awaitTimeout, maxAttempts, putStrategy);
  }

  public StoreConfig withPutStrategy(PutStrategy putStrategy) {
    return new StoreConfig(location, keySize, valueSize, username, password,
        maxPoolSize, pollInterval, awaitTimeout, maxAttempts, putStrategy);
  }

  public StoreConfig withMaxPoolSize(int maxPoolSize) {
    return new StoreConfig(location, keySize, valueSize, username, password,
        maxPoolSize, pollInterval, awaitTimeout, maxAttempts, putStrategy);
  }

  /** Configured location with {@code override} appended (the configured value acts as a prefix). */
  public StoreLocation resolveLocation(String override) {
    String loc = (override == null) ? location : location + override;
    return StoreLocation.parse(loc);
  }

  /** Never prints the password. */
  @Override
  public String toString() {
    return "StoreConfig[location=" + location + ", keySize=" + keySize + ", valueSize=" + valueSize
        + ", username=" + username + ", maxPoolSize=" + maxPoolSize + ", pollInterval=" + pollInterval
        + ", awaitTimeout=" + awaitTimeout + ", maxAttempts=" + maxAttempts + ", putStrategy=" + putStrategy + "]";
  }
}
