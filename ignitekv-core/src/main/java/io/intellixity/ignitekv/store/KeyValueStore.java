package io.intellixity.ignitekv.store;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, byte-oriented key-value store.\n
 *
 * Keys iterate in unsigned lexicographic order. All operations fail with
 * {@link NotInitializedException} before {@link #open()} completes and after {@link #close()}.
 * Byte capacity is half the configured column width, since keys and values are stored hex-encoded;
 * see {@link io.intellixity.ignitekv.config.StoreConfig}.
 */
public interface KeyValueStore extends AutoCloseable {
  /** Connects and bootstraps the backing table. No-op if already open. */
  default void open() {
    open(null);
  }

  /** Like {@link #open()}, appending {@code locationOverride} to the configured location. */
  void open(String locationOverride);

  boolean isOpen();

  /** Returns the value stored for {@code key} or throws {@link NotFoundException}. */
  ByteArray get(ByteArray key);

  /** Returns the value stored for {@code key}, empty if absent. */
  Optional<ByteArray> find(ByteArray key);

  /** Inserts or replaces the value for {@code key}. */
  void put(ByteArray key, ByteArray value);

  /** Removes {@code key}; absent keys are ignored. */
  void delete(ByteArray key);

  /**
   * Applies puts and deletes in request order per key (last write wins).\n
   *
   * Not atomic across the whole batch: a failure may leave part of it applied.
   */
  void batch(List<WriteOp> ops);

  /** Entries matching {@code query}, in key order (descending when reversed). */
  CloseableIterator<KeyValue> iterator(RangeQuery query);

  @Override
  void close();
}
