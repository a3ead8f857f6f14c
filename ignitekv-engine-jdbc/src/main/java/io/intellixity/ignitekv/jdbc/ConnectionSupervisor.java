package io.intellixity.ignitekv.jdbc;

import io.intellixity.ignitekv.exec.ConnectionState;
import io.intellixity.ignitekv.exec.ConnectionStateListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pushes {@link ConnectionState} transitions for a JDBC pool.\n
 *
 * A connection-class failure flips the state to DISCONNECTED and starts probing the pool on a single
 * daemon thread; the first successful probe restores CONNECTED.
 */
final class ConnectionSupervisor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

  /** One health check against the backend. */
  @FunctionalInterface
  interface Probe {
    void check() throws SQLException;
  }

  private final String storeId;
  private final ConnectionStateListener listener;
  private final Probe probe;
  private final Duration probeInterval;
  private final ScheduledExecutorService scheduler;

  private ConnectionState state = ConnectionState.DISCONNECTED;
  private ScheduledFuture<?> probing;
  private boolean closed;

  ConnectionSupervisor(String storeId, ConnectionStateListener listener, Probe probe, Duration probeInterval) {
    this.storeId = Objects.requireNonNull(storeId, "storeId");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.probe = Objects.requireNonNull(probe, "probe");
    this.probeInterval = Objects.requireNonNull(probeInterval, "probeInterval");
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "ignitekv-supervisor-" + storeId);
      t.setDaemon(true);
      return t;
    });
  }

  /** Synchronous first probe: CONNECTED on success, else DISCONNECTED and the failure is rethrown. */
  void connect() throws SQLException {
    transition(ConnectionState.CONNECTING, null);
    try {
      probe.check();
    } catch (SQLException e) {
      transition(ConnectionState.DISCONNECTED, e);
      throw e;
    }
    transition(ConnectionState.CONNECTED, null);
  }

  /** Called by the backend for every failed statement; only connection-class failures change state. */
  void reportFailure(SQLException e) {
    if (!isConnectionFailure(e)) return;
    synchronized (this) {
      if (closed || state != ConnectionState.CONNECTED) return;
      transition(ConnectionState.DISCONNECTED, e);
      probing = scheduler.scheduleWithFixedDelay(this::probeOnce,
          probeInterval.toNanos(), probeInterval.toNanos(), TimeUnit.NANOSECONDS);
    }
  }

  private void probeOnce() {
    try {
      probe.check();
    } catch (SQLException | RuntimeException e) {
      log.debug("ignitekv.supervisor store={} probe failed: {}", storeId, e.toString());
      return;
    }
    synchronized (this) {
      if (closed) return;
      if (probing != null) {
        probing.cancel(false);
        probing = null;
      }
      transition(ConnectionState.CONNECTED, null);
    }
  }

  synchronized ConnectionState state() {
    return state;
  }

  @Override
  public void close() {
    synchronized (this) {
      if (closed) return;
      closed = true;
      if (probing != null) probing.cancel(false);
      probing = null;
      transition(ConnectionState.DISCONNECTED, null);
    }
    scheduler.shutdownNow();
  }

  private synchronized void transition(ConnectionState next, Throwable reason) {
    state = next;
    listener.onStateChange(next, reason);
  }

  static boolean isConnectionFailure(SQLException e) {
    if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) return true;
    String sqlState = e.getSQLState();
    return sqlState != null && sqlState.startsWith("08");
  }
}
