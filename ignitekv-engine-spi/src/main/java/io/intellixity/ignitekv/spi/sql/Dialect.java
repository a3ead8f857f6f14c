package io.intellixity.ignitekv.spi.sql;

import io.intellixity.ignitekv.config.StoreLocation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the statements the store issues against its backing table {@code kvstore(k, v)}.\n
 *
 * All key/value arguments are already encoded column text. Bootstrap statements must be idempotent.
 */
public interface Dialect {
  String id();

  /** Location schemes (e.g. {@code ignite}) this dialect serves. */
  Set<String> schemes();

  SqlStatement createTable(StoreLocation location, int keySize, int valueSize);

  SqlStatement createIndex(StoreLocation location);

  /** Selects {@code v} for one key; at most one row. */
  SqlStatement selectValue(String key);

  /** Atomic insert-or-replace of one row. */
  SqlStatement upsert(String key, String value);

  /** Atomic insert-or-replace of several rows; keys are distinct and the list is non-empty. */
  SqlStatement upsertAll(List<Map.Entry<String, String>> rows);

  SqlStatement update(String key, String value);

  SqlStatement insert(String key, String value);

  SqlStatement delete(String key);

  /** Deletes all given keys; the list is non-empty. */
  SqlStatement deleteAll(List<String> keys);

  /** Selects {@code (k, v)} rows within the range, ordered by {@code k}. */
  SqlStatement selectRange(EncodedRange range);
}
