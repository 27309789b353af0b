package io.mesabi.analytics.jdbc.postgres;

import io.mesabi.analytics.jdbc.bind.DefaultJdbcBinder;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/** Binds text arrays as native Postgres {@code text[]}. */
public final class PostgresBinder extends DefaultJdbcBinder {
  @Override
  protected void bindTextArray(PreparedStatement ps, int pos, List<?> values) throws SQLException {
    Array sqlArr = ps.getConnection().createArrayOf("text", values.toArray());
    ps.setArray(pos, sqlArr);
  }
}
