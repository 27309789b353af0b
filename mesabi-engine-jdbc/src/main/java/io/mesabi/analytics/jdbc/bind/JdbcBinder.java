package io.mesabi.analytics.jdbc.bind;

import io.mesabi.analytics.compile.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Sets one {@link Bind} on a prepared statement. Dialects extend {@link DefaultJdbcBinder} for native types. */
public interface JdbcBinder {
  void bind(PreparedStatement ps, int position1Based, Bind bind) throws SQLException;
}
