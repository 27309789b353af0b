package io.mesabi.analytics.result;

/** Diagnostics returned with every result. Results are never cached, so {@code cached} is always false. */
public record QueryMetadata(int totalRows, long executionTimeMs, boolean cached, String sql) {
  public static QueryMetadata of(int totalRows, long executionTimeMs, String sql) {
    return new QueryMetadata(totalRows, executionTimeMs, false, sql);
  }
}
