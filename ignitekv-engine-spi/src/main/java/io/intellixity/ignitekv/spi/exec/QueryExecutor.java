package io.intellixity.ignitekv.spi.exec;

import io.intellixity.ignitekv.spi.sql.SqlStatement;
import io.intellixity.ignitekv.store.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Runs one statement, waiting for a connected backend and retrying a bounded number of times.\n
 *
 * There is no backoff: the only delay is the connection wait before each attempt.
 * Integrity-constraint violations are not retried.
 */
public final class QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

  /** Backend call for one attempt. */
  @FunctionalInterface
  public interface StatementRunner<T> {
    T run(SqlStatement stmt) throws SQLException;
  }

  private final ConnectionManager connections;
  private final int maxAttempts;

  public QueryExecutor(ConnectionManager connections, int maxAttempts) {
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.maxAttempts = maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public <T> T execute(String op, SqlStatement stmt, StatementRunner<T> runner) {
    Objects.requireNonNull(stmt, "stmt");
    Objects.requireNonNull(runner, "runner");
    Exception last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        connections.awaitConnected();
      } catch (TimeoutException e) {
        last = e;
        log.warn("ignitekv.exec op={} attempt={}/{} gave up waiting for connection: {}",
            op, attempt, maxAttempts, e.getMessage());
        continue;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BackendException(op + " interrupted while waiting for connection", e, attempt);
      }

      try {
        T out = runner.run(stmt);
        if (attempt > 1) log.info("ignitekv.exec op={} succeeded on attempt={}", op, attempt);
        return out;
      } catch (SQLException e) {
        if (isConstraintViolation(e)) {
          throw new BackendException(op + " rejected by backend: " + e.getMessage(), e, attempt, true);
        }
        last = e;
        log.warn("ignitekv.exec op={} attempt={}/{} failed sqlState={} error={}",
            op, attempt, maxAttempts, e.getSQLState(), e.getMessage());
      }
    }
    throw new BackendException(op + " failed after " + maxAttempts + " attempts"
        + (last == null ? "" : ": " + last.getMessage()), last, maxAttempts);
  }

  static boolean isConstraintViolation(SQLException e) {
    if (e instanceof SQLIntegrityConstraintViolationException) return true;
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }
}
