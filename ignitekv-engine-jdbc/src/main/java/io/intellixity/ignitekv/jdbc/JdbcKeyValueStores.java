package io.intellixity.ignitekv.jdbc;

import io.intellixity.ignitekv.config.StoreConfig;
import io.intellixity.ignitekv.jdbc.dialect.JdbcDialect;
import io.intellixity.ignitekv.spi.sql.Dialects;

import java.util.Objects;

/**
 * Creates JDBC stores, picking the dialect from the location scheme.\n
 *
 * Dialects are discovered through {@code META-INF/ignitekv.factories}, so the dialect module
 * (e.g. {@code ignitekv-jdbc-ignite}) only needs to be on the classpath.
 */
public final class JdbcKeyValueStores {
  private JdbcKeyValueStores() {}

  /** Unopened store for {@code config}. */
  public static JdbcKeyValueStore create(StoreConfig config) {
    Objects.requireNonNull(config, "config");
    JdbcDialect dialect = Dialects.forScheme(JdbcDialect.class, schemeOf(config.location()));
    return new JdbcKeyValueStore(config, dialect);
  }

  public static JdbcKeyValueStore open(StoreConfig config) {
    return open(config, null);
  }

  /** Creates and opens a store; the override is appended to the configured location. */
  public static JdbcKeyValueStore open(StoreConfig config, String locationOverride) {
    JdbcKeyValueStore store = create(config);
    store.open(locationOverride);
    return store;
  }

  static String schemeOf(String location) {
    int i = location.indexOf("://");
    if (i <= 0) throw new IllegalArgumentException("Location has no scheme: " + location);
    return location.substring(0, i);
  }
}
