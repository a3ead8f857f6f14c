package io.intellixity.ignitekv.spi.exec;

import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.exec.ConnectionState;
import io.intellixity.ignitekv.exec.ConnectionStateListener;
import io.intellixity.ignitekv.store.NotInitializedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the store lifecycle and the latest backend {@link ConnectionState}.\n
 *
 * The backend pushes transitions through {@link #onStateChange}; callers block in
 * {@link #awaitConnected()} until the state is {@link ConnectionState#CONNECTED}.
 */
public final class ConnectionManager implements ConnectionStateListener {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  enum Lifecycle { CLOSED, OPENING, OPEN }

  private final String storeId;
  private final Duration pollInterval;
  private final Duration awaitTimeout;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile Lifecycle lifecycle = Lifecycle.CLOSED;
  private volatile StoreLocation location;

  /**
   * @param pollInterval re-check interval while waiting for CONNECTED
   * @param awaitTimeout bound of a single wait; zero waits without a deadline
   */
  public ConnectionManager(String storeId, Duration pollInterval, Duration awaitTimeout) {
    this.storeId = Objects.requireNonNull(storeId, "storeId");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.awaitTimeout = Objects.requireNonNull(awaitTimeout, "awaitTimeout");
  }

  @Override
  public void onStateChange(ConnectionState newState, Throwable reason) {
    Objects.requireNonNull(newState, "newState");
    ConnectionState prev;
    lock.lock();
    try {
      prev = state;
      state = newState;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    if (prev == newState) return;
    switch (newState) {
      case CONNECTED -> log.info("ignitekv.conn store={} state={} (was {})", storeId, newState, prev);
      case CONNECTING -> log.debug("ignitekv.conn store={} state={} (was {})", storeId, newState, prev);
      case DISCONNECTED -> {
        if (reason != null) {
          log.warn("ignitekv.conn store={} state={} (was {}) reason={}", storeId, newState, prev, reason.toString());
        } else {
          log.info("ignitekv.conn store={} state={} (was {})", storeId, newState, prev);
        }
      }
    }
  }

  public ConnectionState state() {
    return state;
  }

  public StoreLocation location() {
    return location;
  }

  public boolean isOpen() {
    return lifecycle == Lifecycle.OPEN;
  }

  /** True while opening or open. */
  public boolean isActive() {
    return lifecycle != Lifecycle.CLOSED;
  }

  void beginOpen(StoreLocation location) {
    this.location = Objects.requireNonNull(location, "location");
    setLifecycle(Lifecycle.OPENING);
  }

  void markOpen() {
    setLifecycle(Lifecycle.OPEN);
  }

  void markClosed() {
    setLifecycle(Lifecycle.CLOSED);
  }

  /** Throws {@link NotInitializedException} unless the store is open. */
  public void ensureOpen(String op) {
    if (lifecycle != Lifecycle.OPEN) {
      throw new NotInitializedException("Store " + storeId + " is not open (op=" + op + ")");
    }
  }

  /**
   * Blocks until the state is CONNECTED.\n
   *
   * @throws TimeoutException if the await timeout elapses first
   * @throws NotInitializedException if the store is closed while waiting
   */
  public void awaitConnected() throws InterruptedException, TimeoutException {
    if (state == ConnectionState.CONNECTED && lifecycle != Lifecycle.CLOSED) return;
    long pollNanos = pollInterval.toNanos();
    boolean bounded = !awaitTimeout.isZero();
    long deadline = bounded ? System.nanoTime() + awaitTimeout.toNanos() : 0L;
    lock.lockInterruptibly();
    try {
      while (true) {
        if (lifecycle == Lifecycle.CLOSED) {
          throw new NotInitializedException("Store " + storeId + " was closed");
        }
        if (state == ConnectionState.CONNECTED) return;
        long wait = pollNanos;
        if (bounded) {
          long remaining = deadline - System.nanoTime();
          if (remaining <= 0) {
            throw new TimeoutException("Store " + storeId + " not connected after " + awaitTimeout.toMillis()
                + "ms (state=" + state + ")");
          }
          wait = Math.min(wait, remaining);
        }
        changed.await(wait, TimeUnit.NANOSECONDS);
      }
    } finally {
      lock.unlock();
    }
  }

  private void setLifecycle(Lifecycle next) {
    lock.lock();
    try {
      lifecycle = next;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }
}
