package io.intellixity.ignitekv.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.ignitekv.codec.HexCodec;
import io.intellixity.ignitekv.config.StoreConfig;
import io.intellixity.ignitekv.config.StoreLocation;
import io.intellixity.ignitekv.exec.ConnectionStateListener;
import io.intellixity.ignitekv.jdbc.dialect.JdbcDialect;
import io.intellixity.ignitekv.spi.exec.AbstractSqlKeyValueStore;
import io.intellixity.ignitekv.spi.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Key-value store over a HikariCP pool.\n
 *
 * The pool is created on {@code open} and closed on {@code close}; a {@link ConnectionSupervisor}
 * reports connection state to the store.
 */
public final class JdbcKeyValueStore extends AbstractSqlKeyValueStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcKeyValueStore.class);

  static final Duration CONNECTION_TIMEOUT = Duration.ofSeconds(5);
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final JdbcDialect jdbcDialect;
  private volatile HikariDataSource pool;
  private volatile JdbcHandle handle;
  private volatile ConnectionSupervisor supervisor;

  public JdbcKeyValueStore(StoreConfig config, JdbcDialect dialect) {
    super(config, dialect, HexCodec.INSTANCE);
    this.jdbcDialect = dialect;
  }

  @Override
  protected void connect(StoreLocation location, ConnectionStateListener listener) throws SQLException {
    StoreConfig cfg = config();
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(jdbcDialect.jdbcUrl(location));
    hc.setUsername(cfg.username());
    hc.setPassword(cfg.password());
    hc.setMaximumPoolSize(cfg.maxPoolSize());
    hc.setPoolName("ignitekv-" + location.cacheName());
    hc.setConnectionTimeout(CONNECTION_TIMEOUT.toMillis());
    // the first probe below decides whether open succeeds
    hc.setInitializationFailTimeout(-1);
    HikariDataSource ds = new HikariDataSource(hc);

    this.pool = ds;
    this.handle = new JdbcHandle("jdbc:" + location, ds, location.cacheName());
    ConnectionSupervisor sup = new ConnectionSupervisor(location.cacheName(), listener, () -> probe(ds), cfg.pollInterval());
    this.supervisor = sup;
    sup.connect();
  }

  private static void probe(HikariDataSource ds) throws SQLException {
    try (Connection c = ds.getConnection()) {
      if (!c.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        throw new SQLTransientConnectionException("Connection failed validation", "08006");
      }
    }
  }

  @Override
  protected void disconnect() {
    ConnectionSupervisor sup = supervisor;
    HikariDataSource ds = pool;
    supervisor = null;
    pool = null;
    handle = null;
    if (sup != null) sup.close();
    if (ds != null) ds.close();
  }

  /** Handle of the open pool, else null. */
  public JdbcHandle handle() {
    return handle;
  }

  @Override
  protected List<List<Object>> executeQuery(SqlStatement stmt) throws SQLException {
    JdbcHandle h = requireHandle();
    long start = System.nanoTime();
    debugSql(stmt, h);
    try (Connection c = h.client().getConnection();
         PreparedStatement ps = c.prepareStatement(stmt.sql())) {
      bindAll(ps, stmt);
      try (ResultSet rs = ps.executeQuery()) {
        int cols = rs.getMetaData().getColumnCount();
        List<List<Object>> out = new ArrayList<>();
        while (rs.next()) {
          List<Object> row = new ArrayList<>(cols);
          for (int i = 1; i <= cols; i++) row.add(rs.getString(i));
          out.add(row);
        }
        debugDone(stmt, out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      reportFailure(e);
      throw e;
    }
  }

  @Override
  protected long executeUpdate(SqlStatement stmt) throws SQLException {
    JdbcHandle h = requireHandle();
    long start = System.nanoTime();
    debugSql(stmt, h);
    try (Connection c = h.client().getConnection();
         PreparedStatement ps = c.prepareStatement(stmt.sql())) {
      bindAll(ps, stmt);
      long n = ps.executeUpdate();
      debugDone(stmt, n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      reportFailure(e);
      throw e;
    }
  }

  private JdbcHandle requireHandle() throws SQLException {
    JdbcHandle h = handle;
    if (h == null) throw new SQLNonTransientConnectionException("Store has no open pool", "08003");
    return h;
  }

  private void reportFailure(SQLException e) {
    ConnectionSupervisor sup = supervisor;
    if (sup != null) sup.reportFailure(e);
  }

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    List<Object> args = stmt.args();
    for (int i = 0; i < args.size(); i++) {
      Object v = args.get(i);
      if (v == null) {
        ps.setNull(i + 1, Types.VARCHAR);
      } else {
        ps.setObject(i + 1, v);
      }
    }
  }

  private static void debugSql(SqlStatement ss, JdbcHandle h) {
    if (!log.isDebugEnabled()) return;
    log.debug("ignitekv.jdbc op={} execKind={} bindCount={} handleId={} sql={}",
        verb(ss.sql()), ss.execKind(), ss.args().size(), h.id(), ss.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.args()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("ignitekv.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private static void debugDone(SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("ignitekv.jdbc_done op={} execKind={} durationMs={} result={}",
        verb(ss.sql()), ss.execKind(), durationNanos / 1_000_000.0, result);
  }

  private static String verb(String sql) {
    String s = sql.stripLeading();
    int sp = s.indexOf(' ');
    return (sp < 0 ? s : s.substring(0, sp)).toUpperCase(Locale.ROOT);
  }
}
