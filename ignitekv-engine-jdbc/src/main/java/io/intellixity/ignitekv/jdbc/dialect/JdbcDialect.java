package io.intellixity.ignitekv.jdbc.dialect;

import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.spi.sql.Dialect;

/** Dialect for JDBC backends (statement rendering plus driver URL). */
public interface JdbcDialect extends Dialect {
  /** JDBC URL the pool connects to for {@code location}. */
  String jdbcUrl(StoreLocation location);
}
