package io.mesabi.analytics.jdbc;

import java.util.List;
import java.util.Map;

/** One blocking round trip: runs a compiled statement and returns raw rows keyed by column label. */
public interface QueryExecutor {
  List<Map<String, Object>> query(SqlStatement statement);
}
