package io.mesabi.analytics.jdbc;

import io.mesabi.analytics.compile.Bind;
import io.mesabi.analytics.jdbc.bind.JdbcBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** {@link QueryExecutor} over a pooled {@link DataSource}; the connection is released after every call. */
public final class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final DataSource ds;
  private final JdbcBinder binder;
  private final int timeoutSeconds;

  public JdbcQueryExecutor(DataSource ds, JdbcBinder binder, Duration timeout) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binder = Objects.requireNonNull(binder, "binder");
    // JDBC timeouts are whole seconds; round up so a sub-second timeout still applies
    long ms = (timeout == null) ? 0 : timeout.toMillis();
    this.timeoutSeconds = (int) Math.min(Integer.MAX_VALUE, (ms + 999) / 1000);
  }

  @Override
  public List<Map<String, Object>> query(SqlStatement ss) {
    String jdbcSql = NamedParameterSql.toJdbcSql(ss.sql());
    int params = NamedParameterSql.countParams(ss.sql());
    if (params != ss.binds().size()) {
      throw new IllegalStateException("Statement has " + params + " placeholders but " + ss.binds().size() + " binds");
    }
    try (Connection c = ds.getConnection()) {
      long start = System.nanoTime();
      debugSql(ss, jdbcSql);
      try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
        if (timeoutSeconds > 0) ps.setQueryTimeout(timeoutSeconds);
        bindAll(ps, ss);
        try (ResultSet rs = ps.executeQuery()) {
          List<Map<String, Object>> out = JdbcRows.readAll(rs);
          debugDone(out.size(), System.nanoTime() - start);
          return out;
        }
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      binder.bind(ps, i + 1, ss.binds().get(i));
    }
  }

  private void debugSql(SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("mesabi.jdbc op=SELECT bindCount={} joins={} timeoutSeconds={} sql={}",
        ss.binds().size(), ss.joinAliases(), timeoutSeconds, jdbcSql);

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        log.trace("mesabi.jdbc bind index={} type={} valueType={}",
            idx++, b.type(), v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private void debugDone(int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("mesabi.jdbc_done op=SELECT durationMs={} rows={}", durationNanos / 1_000_000.0, rows);
  }
}
