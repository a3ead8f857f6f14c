package io.intellixity.ignitekv.jdbc.dialect;

import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.spi.sql.EncodedRange;
import io.intellixity.ignitekv.spi.sql.SqlStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - bootstrap: {@code kvstore(k, v)} table and its key index\n
 * - CRUD and batch DML with positional binds\n
 * - range selects: bounds joined with AND, ordered by key, optional limit\n
 *
 * DB-specific dialects override hooks for column types, table options, upsert and limit syntax.\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  public static final String TABLE = "kvstore";
  public static final String KEY_COLUMN = "k";
  public static final String VALUE_COLUMN = "v";
  public static final String KEY_INDEX = "kvstore_k";

  @Override
  public SqlStatement createTable(StoreLocation location, int keySize, int valueSize) {
    Objects.requireNonNull(location, "location");
    String sql = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
        + KEY_COLUMN + " " + columnType(keySize) + ", "
        + VALUE_COLUMN + " " + columnType(valueSize) + ", "
        + "PRIMARY KEY (" + KEY_COLUMN + "))"
        + createTableSuffix(location);
    return SqlStatement.update(sql, List.of());
  }

  @Override
  public SqlStatement createIndex(StoreLocation location) {
    return SqlStatement.update(
        "CREATE INDEX IF NOT EXISTS " + KEY_INDEX + " ON " + TABLE + " (" + KEY_COLUMN + ")", List.of());
  }

  @Override
  public SqlStatement selectValue(String key) {
    return SqlStatement.query(
        "SELECT " + VALUE_COLUMN + " FROM " + TABLE + " WHERE " + KEY_COLUMN + " = ?", List.of(key));
  }

  @Override
  public SqlStatement upsert(String key, String value) {
    return upsertAll(List.of(Map.entry(key, value)));
  }

  @Override
  public SqlStatement upsertAll(List<Map.Entry<String, String>> rows) {
    if (rows == null || rows.isEmpty()) throw new IllegalArgumentException("upsertAll requires at least one row");
    StringJoiner values = new StringJoiner(", ");
    List<Object> args = new ArrayList<>(rows.size() * 2);
    for (Map.Entry<String, String> row : rows) {
      values.add("(?, ?)");
      args.add(row.getKey());
      args.add(row.getValue());
    }
    return SqlStatement.update(renderUpsertAll(values.toString()), args);
  }

  @Override
  public SqlStatement update(String key, String value) {
    return SqlStatement.update(
        "UPDATE " + TABLE + " SET " + VALUE_COLUMN + " = ? WHERE " + KEY_COLUMN + " = ?", List.of(value, key));
  }

  @Override
  public SqlStatement insert(String key, String value) {
    return SqlStatement.update(
        "INSERT INTO " + TABLE + " (" + KEY_COLUMN + ", " + VALUE_COLUMN + ") VALUES (?, ?)", List.of(key, value));
  }

  @Override
  public SqlStatement delete(String key) {
    return SqlStatement.update("DELETE FROM " + TABLE + " WHERE " + KEY_COLUMN + " = ?", List.of(key));
  }

  @Override
  public SqlStatement deleteAll(List<String> keys) {
    if (keys == null || keys.isEmpty()) throw new IllegalArgumentException("deleteAll requires at least one key");
    StringJoiner marks = new StringJoiner(", ", "(", ")");
    for (int i = 0; i < keys.size(); i++) marks.add("?");
    return SqlStatement.update(
        "DELETE FROM " + TABLE + " WHERE " + KEY_COLUMN + " IN " + marks, new ArrayList<>(keys));
  }

  @Override
  public SqlStatement selectRange(EncodedRange range) {
    Objects.requireNonNull(range, "range");
    StringBuilder sql = new StringBuilder("SELECT " + KEY_COLUMN + ", " + VALUE_COLUMN + " FROM " + TABLE);
    List<Object> args = new ArrayList<>(2);
    List<String> wheres = new ArrayList<>(2);
    if (range.lower() != null) {
      wheres.add(KEY_COLUMN + (range.lowerInclusive() ? " >= ?" : " > ?"));
      args.add(range.lower());
    }
    if (range.upper() != null) {
      wheres.add(KEY_COLUMN + (range.upperInclusive() ? " <= ?" : " < ?"));
      args.add(range.upper());
    }
    if (!wheres.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", wheres));
    sql.append(" ORDER BY ").append(KEY_COLUMN).append(range.reverse() ? " DESC" : " ASC");
    String out = range.hasLimit() ? applyLimit(sql.toString(), range.limit()) : sql.toString();
    return SqlStatement.query(out, args);
  }

  /** SQL type of a text column holding {@code width} encoded characters. */
  protected abstract String columnType(int width);

  /** Appended after the closing parenthesis of CREATE TABLE. Default: nothing. */
  protected String createTableSuffix(StoreLocation location) {
    return "";
  }

  /** Multi-row upsert; {@code valuesList} is {@code (?, ?), (?, ?), ...} binding k then v per row. */
  protected String renderUpsertAll(String valuesList) {
    return "MERGE INTO " + TABLE + " (" + KEY_COLUMN + ", " + VALUE_COLUMN + ") VALUES " + valuesList;
  }

  protected String applyLimit(String sql, int limit) {
    return sql + " LIMIT " + limit;
  }
}
