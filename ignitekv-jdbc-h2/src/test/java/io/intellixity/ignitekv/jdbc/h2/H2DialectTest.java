package io.intellixity.ignitekv.jdbc.h2;

import io.intellixity.ignitekv.config.StoreLocation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class H2DialectTest {
  private final H2Dialect d = new H2Dialect();

  @Test
  void mapsMemHostToInProcessDatabase() {
    assertEquals("jdbc:h2:mem:orders;DB_CLOSE_DELAY=-1", d.jdbcUrl(StoreLocation.parse("h2://mem/orders")));
    assertEquals("jdbc:h2:tcp://db:9092/mem:orders", d.jdbcUrl(StoreLocation.parse("h2://db:9092/orders")));
  }

  @Test
  void usesVarcharWithoutTableOptions() {
    assertEquals("CREATE TABLE IF NOT EXISTS kvstore (k VARCHAR(8), v VARCHAR(16), PRIMARY KEY (k))",
        d.createTable(StoreLocation.parse("h2://mem/orders"), 8, 16).sql());
  }

  @Test
  void mergeNamesKeyColumn() {
    assertEquals("MERGE INTO kvstore (k, v) KEY (k) VALUES (?, ?)", d.upsertAll(List.of(Map.entry("61", "31"))).sql());
  }
}
