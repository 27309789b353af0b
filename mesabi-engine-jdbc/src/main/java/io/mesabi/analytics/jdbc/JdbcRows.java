package io.mesabi.analytics.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result rows into insertion-ordered maps keyed by column label. */
final class JdbcRows {
  private JdbcRows() {}

  static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    boolean[] zoned = new boolean[n];
    for (int i = 1; i <= n; i++) {
      labels[i - 1] = md.getColumnLabel(i);
      zoned[i - 1] = md.getColumnType(i) == Types.TIMESTAMP_WITH_TIMEZONE
          || "timestamptz".equalsIgnoreCase(md.getColumnTypeName(i));
    }

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= n; i++) {
        Object v = raw(rs.getObject(i));
        // a Timestamp drops the offset; keep the instant for zoned columns
        if (zoned[i - 1] && v instanceof Timestamp ts) v = ts.toInstant().atOffset(ZoneOffset.UTC);
        row.put(labels[i - 1], v);
      }
      out.add(row);
    }
    return out;
  }

  // java.sql.Array is only readable while the result set is open
  private static Object raw(Object v) throws SQLException {
    if (v instanceof java.sql.Array a) {
      try {
        return a.getArray();
      } finally {
        a.free();
      }
    }
    return v;
  }
}
