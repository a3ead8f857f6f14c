package io.intellixity.ignitekv.jdbc.ignite;

import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.jdbc.dialect.JdbcDialect;
import io.intellixity.ignitekv.spi.sql.Dialects;
import io.intellixity.ignitekv.spi.sql.EncodedRange;
import io.intellixity.ignitekv.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class IgniteDialectTest {
  private final IgniteDialect d = new IgniteDialect();

  @Test
  void createsPartitionedTableNamedAfterCache() {
    StoreLocation loc = StoreLocation.parse("ignite://127.0.0.1:10800/orders");
    SqlStatement s = d.createTable(loc, 256, 1024);
    assertEquals("CREATE TABLE IF NOT EXISTS kvstore (k CHAR(256), v CHAR(1024), PRIMARY KEY (k))"
        + " WITH \"template=partitioned, backups=1, affinityKey=k, CACHE_NAME=orders_kvstore\"", s.sql());
    assertEquals("CREATE INDEX IF NOT EXISTS kvstore_k ON kvstore (k)", d.createIndex(loc).sql());
  }

  @Test
  void buildsThinDriverUrl() {
    assertEquals("jdbc:ignite:thin://10.0.0.5:10801", d.jdbcUrl(StoreLocation.parse("ignite://10.0.0.5:10801/c")));
    assertEquals("jdbc:ignite:thin://node1:10800", d.jdbcUrl(StoreLocation.parse("ignite://node1/c")));
  }

  @Test
  void mergesWithoutKeyClause() {
    SqlStatement s = d.upsertAll(List.of(Map.entry("61", "31"), Map.entry("62", "32")));
    assertEquals("MERGE INTO kvstore (k, v) VALUES (?, ?), (?, ?)", s.sql());
  }

  @Test
  void rangeUsesLimitClause() {
    SqlStatement s = d.selectRange(new EncodedRange("61", true, null, false, true, 5));
    assertEquals("SELECT k, v FROM kvstore WHERE k >= ? ORDER BY k DESC LIMIT 5", s.sql());
  }

  @Test
  void isRegisteredForIgniteScheme() {
    assertInstanceOf(IgniteDialect.class, Dialects.forScheme(JdbcDialect.class, "ignite"));
  }
}
