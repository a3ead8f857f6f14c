package io.intellixity.ignitekv.spi.exec;

import io.intellixity.ignitekv.codec.Codec;
import io.intellixity.ignitekv.codec.ColumnCodec;
import io.intellixity.ignitekv.config.PutStrategy;
import io.intellixity.ignitekv.config.StoreConfig;
import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.exec.ConnectionState;
import io.intellixity.ignitekv.exec.ConnectionStateListener;
import io.intellixity.ignitekv.spi.sql.Dialect;
import io.intellixity.ignitekv.spi.sql.EncodedRange;
import io.intellixity.ignitekv.spi.sql.SqlStatement;
import io.intellixity.ignitekv.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Template-method key-value store over a SQL backend.\n
 *
 * Responsibilities:\n
 * - Lifecycle (open/close) and connection-state tracking via {@link ConnectionManager}\n
 * - Schema bootstrap, CRUD, batch and range statements via {@link Dialect}\n
 * - Key/value encoding via {@link ColumnCodec}\n
 * - Bounded retry via {@link QueryExecutor}\n
 *
 * Backends implement connect/disconnect and the two execution hooks.
 */
public abstract class AbstractSqlKeyValueStore implements KeyValueStore {
  private static final Logger log = LoggerFactory.getLogger(AbstractSqlKeyValueStore.class);

  private final StoreConfig config;
  private final Dialect dialect;
  private final ColumnCodec keys;
  private final ColumnCodec values;
  private final ConnectionManager connections;
  private final QueryExecutor executor;
  private final Object lifecycleLock = new Object();

  protected AbstractSqlKeyValueStore(StoreConfig config, Dialect dialect, Codec codec) {
    this.config = Objects.requireNonNull(config, "config");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(codec, "codec");
    this.keys = new ColumnCodec("key", config.keySize(), codec);
    this.values = new ColumnCodec("value", config.valueSize(), codec);
    this.connections = new ConnectionManager(config.location(), config.pollInterval(), config.awaitTimeout());
    this.executor = new QueryExecutor(connections, config.maxAttempts());
  }

  /**
   * Establishes the backend connection and registers {@code listener} for state transitions.\n
   *
   * Must push {@link ConnectionState#CONNECTED} once usable; throwing aborts {@code open}.
   */
  protected abstract void connect(StoreLocation location, ConnectionStateListener listener) throws SQLException;

  /** Releases the backend connection. Must not throw. */
  protected abstract void disconnect();

  /** Runs a {@link SqlStatement.ExecKind#QUERY} statement; rows as column-value lists. */
  protected abstract List<List<Object>> executeQuery(SqlStatement stmt) throws SQLException;

  /** Runs a {@link SqlStatement.ExecKind#UPDATE} statement; returns the update count. */
  protected abstract long executeUpdate(SqlStatement stmt) throws SQLException;

  public final StoreConfig config() { return config; }
  public final Dialect dialect() { return dialect; }
  public final ConnectionState connectionState() { return connections.state(); }

  /** Location of the open (or opening) store, else null. */
  public final StoreLocation location() {
    return connections.isActive() ? connections.location() : null;
  }

  @Override
  public final void open(String locationOverride) {
    synchronized (lifecycleLock) {
      if (connections.isActive()) {
        log.debug("ignitekv.store open ignored: already open at {}", connections.location());
        return;
      }
      StoreLocation loc = config.resolveLocation(locationOverride);
      connections.beginOpen(loc);
      boolean opened = false;
      try {
        connect(loc, connections);
        update("bootstrap.table", dialect.createTable(loc, config.keySize(), config.valueSize()));
        update("bootstrap.index", dialect.createIndex(loc));
        connections.markOpen();
        opened = true;
      } catch (SQLException | RuntimeException | LinkageError e) {
        // LinkageError: driver class failed to load or initialize
        throw new InitializationException("Could not initialize store at " + loc + ": " + e, e);
      } finally {
        if (!opened) {
          connections.markClosed();
          disconnect();
        }
      }
      log.info("ignitekv.store opened location={} dialect={} keySize={} valueSize={}",
          loc, dialect.id(), config.keySize(), config.valueSize());
    }
  }

  @Override
  public final boolean isOpen() {
    return connections.isOpen();
  }

  @Override
  public final void close() {
    synchronized (lifecycleLock) {
      if (!connections.isActive()) return;
      StoreLocation loc = connections.location();
      connections.markClosed();
      disconnect();
      log.info("ignitekv.store closed location={}", loc);
    }
  }

  @Override
  public final ByteArray get(ByteArray key) {
    return lookup("get", key).orElseThrow(() -> new NotFoundException(key));
  }

  @Override
  public final Optional<ByteArray> find(ByteArray key) {
    return lookup("find", key);
  }

  private Optional<ByteArray> lookup(String op, ByteArray key) {
    connections.ensureOpen(op);
    String k = keys.encode(requireKey(key));
    List<List<Object>> rows = query(op, dialect.selectValue(k));
    if (rows.isEmpty()) return Optional.empty();
    return Optional.of(values.decode(text(rows.get(0), 0)));
  }

  @Override
  public final void put(ByteArray key, ByteArray value) {
    connections.ensureOpen("put");
    String k = keys.encode(requireKey(key));
    String v = values.encode(Objects.requireNonNull(value, "value"));
    if (config.putStrategy() == PutStrategy.MERGE) {
      update("put", dialect.upsert(k, v));
    } else {
      updateThenInsert(k, v);
    }
  }

  private void updateThenInsert(String k, String v) {
    if (update("put.update", dialect.update(k, v)) > 0) return;
    try {
      update("put.insert", dialect.insert(k, v));
    } catch (BackendException e) {
      if (!e.isConstraintViolation()) throw e;
      // A concurrent writer inserted the key between our update and insert.
      log.debug("ignitekv.store put raced with concurrent insert; retrying as update");
      update("put.update", dialect.update(k, v));
    }
  }

  @Override
  public final void delete(ByteArray key) {
    connections.ensureOpen("delete");
    update("delete", dialect.delete(keys.encode(requireKey(key))));
  }

  @Override
  public final void batch(List<WriteOp> ops) {
    connections.ensureOpen("batch");
    BatchPlan plan = BatchPlan.of(ops);
    if (plan.isEmpty()) return;

    // Encode everything first so a size violation issues no statement.
    List<String> deletes = new ArrayList<>(plan.deletes().size());
    for (ByteArray key : plan.deletes()) deletes.add(keys.encode(requireKey(key)));
    List<Map.Entry<String, String>> puts = new ArrayList<>(plan.puts().size());
    for (WriteOp.Put p : plan.puts()) {
      puts.add(new AbstractMap.SimpleImmutableEntry<>(keys.encode(requireKey(p.key())), values.encode(p.value())));
    }

    if (!deletes.isEmpty()) update("batch.delete", dialect.deleteAll(deletes));
    if (!puts.isEmpty()) update("batch.put", dialect.upsertAll(puts));
    log.debug("ignitekv.store batch applied ops={} deletes={} puts={}", ops.size(), deletes.size(), puts.size());
  }

  /**
   * Issues one range query and hands out its rows.\n
   *
   * The whole result is fetched before the first element is returned.
   */
  @Override
  public final CloseableIterator<KeyValue> iterator(RangeQuery query) {
    connections.ensureOpen("iterator");
    Objects.requireNonNull(query, "query");
    EncodedRange range = new EncodedRange(
        query.lower() == null ? null : keys.encodeOperand(query.lower()), query.lowerInclusive(),
        query.upper() == null ? null : keys.encodeOperand(query.upper()), query.upperInclusive(),
        query.reverse(), query.limit());
    List<List<Object>> rows = query("iterator", dialect.selectRange(range));
    List<KeyValue> out = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      out.add(new KeyValue(keys.decode(text(row, 0)), values.decode(text(row, 1))));
    }
    return CloseableIterator.wrap(out.iterator());
  }

  private List<List<Object>> query(String op, SqlStatement stmt) {
    return executor.execute(op, stmt, this::executeQuery);
  }

  private long update(String op, SqlStatement stmt) {
    return executor.execute(op, stmt, this::executeUpdate);
  }

  private static ByteArray requireKey(ByteArray key) {
    Objects.requireNonNull(key, "key");
    if (key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
    return key;
  }

  private static String text(List<Object> row, int col) {
    Object v = row.get(col);
    if (v == null) throw new IllegalStateException("Unexpected NULL in column " + (col + 1) + " of kvstore row");
    return v.toString();
  }
}
