package io.intellixity.ignitekv.jdbc.ignite;

import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.ignitekv.jdbc.dialect.JdbcDialect;

import java.util.Set;

/**
 * Apache Ignite dialect over the JDBC thin driver.
 *
 * Keeps only Ignite-specific overrides: fixed-width CHAR columns and the cache template clause.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class IgniteDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  public static final int DEFAULT_PORT = 10800;

  @Override public String id() { return "ignite"; }

  @Override public Set<String> schemes() { return Set.of("ignite"); }

  @Override
  public String jdbcUrl(StoreLocation location) {
    int port = location.port() < 0 ? DEFAULT_PORT : location.port();
    return "jdbc:ignite:thin://" + location.host() + ":" + port;
  }

  @Override
  protected String columnType(int width) {
    return "CHAR(" + width + ")";
  }

  @Override
  protected String createTableSuffix(StoreLocation location) {
    return " WITH \"template=partitioned, backups=1, affinityKey=" + KEY_COLUMN
        + ", CACHE_NAME=" + location.cacheName() + "_" + TABLE + "\"";
  }
}
