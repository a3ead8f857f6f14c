package io.intellixity.ignitekv.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** Pooled JDBC client of one open store. */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;
  private final String cacheName;

  public JdbcHandle(String id, DataSource client, String cacheName) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.cacheName = Objects.requireNonNull(cacheName, "cacheName");
  }

  public String id() { return id; }
  public DataSource client() { return client; }
  public String cacheName() { return cacheName; }
}
