package io.intellixity.ignitekv.jdbc.dialect;

import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.spi.sql.EncodedRange;
import io.intellixity.ignitekv.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  private static final class PlainDialect extends AbstractJdbcSqlDialect {
    @Override public String id() { return "plain"; }
    @Override public Set<String> schemes() { return Set.of("plain"); }
    @Override public String jdbcUrl(StoreLocation location) { return "jdbc:plain:" + location.cacheName(); }
    @Override protected String columnType(int width) { return "VARCHAR(" + width + ")"; }
  }

  private final PlainDialect d = new PlainDialect();
  private final StoreLocation loc = new StoreLocation("plain", "localhost", -1, "orders");

  @Test
  void rendersBootstrapStatements() {
    SqlStatement table = d.createTable(loc, 256, 1024);
    assertEquals("CREATE TABLE IF NOT EXISTS kvstore (k VARCHAR(256), v VARCHAR(1024), PRIMARY KEY (k))", table.sql());
    assertEquals(SqlStatement.ExecKind.UPDATE, table.execKind());
    assertEquals("CREATE INDEX IF NOT EXISTS kvstore_k ON kvstore (k)", d.createIndex(loc).sql());
  }

  @Test
  void rendersCrud() {
    SqlStatement get = d.selectValue("6b");
    assertEquals("SELECT v FROM kvstore WHERE k = ?", get.sql());
    assertEquals(SqlStatement.ExecKind.QUERY, get.execKind());
    assertEquals(List.of("6b"), get.args());

    SqlStatement update = d.update("6b", "76");
    assertEquals("UPDATE kvstore SET v = ? WHERE k = ?", update.sql());
    assertEquals(List.of("76", "6b"), update.args());

    assertEquals("INSERT INTO kvstore (k, v) VALUES (?, ?)", d.insert("6b", "76").sql());
    assertEquals("DELETE FROM kvstore WHERE k = ?", d.delete("6b").sql());

    SqlStatement upsert = d.upsert("6b", "76");
    assertEquals("MERGE INTO kvstore (k, v) VALUES (?, ?)", upsert.sql());
    assertEquals(List.of("6b", "76"), upsert.args());
  }

  @Test
  void rendersBatchStatements() {
    SqlStatement del = d.deleteAll(List.of("61", "62", "63"));
    assertEquals("DELETE FROM kvstore WHERE k IN (?, ?, ?)", del.sql());
    assertEquals(List.of("61", "62", "63"), del.args());

    SqlStatement merge = d.upsertAll(List.of(Map.entry("61", "31"), Map.entry("62", "32")));
    assertEquals("MERGE INTO kvstore (k, v) VALUES (?, ?), (?, ?)", merge.sql());
    assertEquals(List.of("61", "31", "62", "32"), merge.args());

    assertThrows(IllegalArgumentException.class, () -> d.deleteAll(List.of()));
    assertThrows(IllegalArgumentException.class, () -> d.upsertAll(List.of()));
  }

  @Test
  void fullScanHasNoWhere() {
    SqlStatement s = d.selectRange(new EncodedRange(null, false, null, false, false, -1));
    assertEquals("SELECT k, v FROM kvstore ORDER BY k ASC", s.sql());
    assertTrue(s.args().isEmpty());
  }

  @Test
  void boundsAreJoinedWithAnd() {
    SqlStatement s = d.selectRange(new EncodedRange("61", true, "63", false, true, -1));
    assertEquals("SELECT k, v FROM kvstore WHERE k >= ? AND k < ? ORDER BY k DESC", s.sql());
    assertEquals(List.of("61", "63"), s.args());
  }

  @Test
  void exclusiveLowerInclusiveUpperWithLimit() {
    SqlStatement s = d.selectRange(new EncodedRange("61", false, "63", true, false, 10));
    assertEquals("SELECT k, v FROM kvstore WHERE k > ? AND k <= ? ORDER BY k ASC LIMIT 10", s.sql());
  }

  @Test
  void singleUpperBound() {
    SqlStatement s = d.selectRange(new EncodedRange(null, false, "63", true, false, 0));
    assertEquals("SELECT k, v FROM kvstore WHERE k <= ? ORDER BY k ASC LIMIT 0", s.sql());
    assertEquals(List.of("63"), s.args());
  }
}
