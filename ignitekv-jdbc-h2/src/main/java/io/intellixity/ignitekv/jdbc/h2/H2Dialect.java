package io.intellixity.ignitekv.jdbc.h2;

import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.ignitekv.jdbc.dialect.JdbcDialect;

import java.util.Set;

/**
 * H2 dialect for local development and tests.\n
 *
 * {@code h2://mem/<cache>} maps to an in-process in-memory database named after the cache;
 * any other host is reached over TCP ({@code jdbc:h2:tcp://host[:port]/mem:<cache>}).
 */
public final class H2Dialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  public static final String IN_PROCESS_HOST = "mem";

  @Override public String id() { return "h2"; }

  @Override public Set<String> schemes() { return Set.of("h2"); }

  @Override
  public String jdbcUrl(StoreLocation location) {
    if (IN_PROCESS_HOST.equals(location.host())) {
      return "jdbc:h2:mem:" + location.cacheName() + ";DB_CLOSE_DELAY=-1";
    }
    return "jdbc:h2:tcp://" + location.authority() + "/mem:" + location.cacheName();
  }

  // VARCHAR keeps values unpadded
  @Override
  protected String columnType(int width) {
    return "VARCHAR(" + width + ")";
  }

  @Override
  protected String renderUpsertAll(String valuesList) {
    return "MERGE INTO " + TABLE + " (" + KEY_COLUMN + ", " + VALUE_COLUMN + ") KEY (" + KEY_COLUMN + ") VALUES " + valuesList;
  }
}
