package io.mesabi.analytics.jdbc.bind;

import io.mesabi.analytics.catalog.ColumnType;
import io.mesabi.analytics.compile.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * JDBC binder shared by all dialects. Values arrive already coerced to their column type; this class only maps
 * them onto the matching {@link PreparedStatement} setter.
 */
public class DefaultJdbcBinder implements JdbcBinder {
  @Override
  public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
    Object v = bind.value();
    ColumnType type = bind.type();
    if (v == null) {
      ps.setNull(pos, sqlType(type));
      return;
    }
    switch (type) {
      case TEXT_ARRAY -> bindTextArray(ps, pos, (List<?>) v);
      case TIMESTAMP -> {
        if (v instanceof LocalDateTime ldt) ps.setTimestamp(pos, Timestamp.valueOf(ldt));
        else ps.setObject(pos, v);
      }
      case DATE -> {
        if (v instanceof LocalDate ld) ps.setDate(pos, java.sql.Date.valueOf(ld));
        else ps.setObject(pos, v);
      }
      default -> ps.setObject(pos, v);
    }
  }

  /** Default has no portable array binding; dialects with native arrays override. */
  protected void bindTextArray(PreparedStatement ps, int pos, List<?> values) throws SQLException {
    throw new SQLFeatureNotSupportedException("Text array binds are not supported by this dialect");
  }

  protected int sqlType(ColumnType type) {
    return switch (type) {
      case INTEGER -> Types.BIGINT;
      case DECIMAL -> Types.NUMERIC;
      case TEXT -> Types.VARCHAR;
      case BOOLEAN -> Types.BOOLEAN;
      case DATE -> Types.DATE;
      case TIMESTAMP -> Types.TIMESTAMP;
      case TEXT_ARRAY -> Types.ARRAY;
    };
  }
}
