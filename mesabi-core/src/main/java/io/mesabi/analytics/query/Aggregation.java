package io.mesabi.analytics.query;

import java.util.Locale;

public enum Aggregation {
  SUM,
  AVG,
  COUNT,
  MIN,
  MAX,
  DISTINCT_COUNT;

  public String wireName() { return name().toLowerCase(Locale.ROOT); }

  public static Aggregation fromWire(String raw) {
    if (raw == null || raw.isBlank()) throw new QueryValidationException("Missing aggregation");
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unsupported aggregation: " + raw, e);
    }
  }
}
