package io.intellixity.ignitekv.examples.config;

import io.intellixity.ignitekv.config.PutStrategy;
import io.intellixity.ignitekv.config.StoreConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "ignitekv")
public class KvStoreProperties {
  /** Store location, e.g. ignite://127.0.0.1:10800/ or h2://mem/ (prefix of the full location). */
  private String location = "h2://mem/";
  /** Appended to {@code location} on open; usually the cache name. */
  private String cache = "examples";
  private int keySize = 256;
  private int valueSize = 1024;
  private String username;
  private String password;
  private int maxPoolSize = StoreConfig.DEFAULT_MAX_POOL_SIZE;
  private int maxAttempts = StoreConfig.DEFAULT_MAX_ATTEMPTS;
  private Duration pollInterval = StoreConfig.DEFAULT_POLL_INTERVAL;
  private Duration awaitTimeout = StoreConfig.DEFAULT_AWAIT_TIMEOUT;
  private PutStrategy putStrategy = PutStrategy.MERGE;

  public StoreConfig toStoreConfig() {
    return new StoreConfig(location, keySize, valueSize, username, password,
        maxPoolSize, pollInterval, awaitTimeout, maxAttempts, putStrategy);
  }

  public String getLocation() { return location; }
  public void setLocation(String location) { this.location = location; }
  public String getCache() { return cache; }
  public void setCache(String cache) { this.cache = cache; }
  public int getKeySize() { return keySize; }
  public void setKeySize(int keySize) { this.keySize = keySize; }
  public int getValueSize() { return valueSize; }
  public void setValueSize(int valueSize) { this.valueSize = valueSize; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public int getMaxPoolSize() { return maxPoolSize; }
  public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
  public int getMaxAttempts() { return maxAttempts; }
  public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
  public Duration getPollInterval() { return pollInterval; }
  public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
  public Duration getAwaitTimeout() { return awaitTimeout; }
  public void setAwaitTimeout(Duration awaitTimeout) { this.awaitTimeout = awaitTimeout; }
  public PutStrategy getPutStrategy() { return putStrategy; }
  public void setPutStrategy(PutStrategy putStrategy) { this.putStrategy = putStrategy; }
}
