package io.mesabi.analytics.query;

import java.util.Locale;

/** Temporal bucket sizes accepted by {@code DATE_TRUNC}. */
public enum TimeGrouping {
  MINUTE,
  HOUR,
  DAY,
  WEEK,
  MONTH,
  QUARTER,
  YEAR;

  public String unit() { return name().toLowerCase(Locale.ROOT); }

  public static TimeGrouping fromWire(String raw) {
    if (raw == null || raw.isBlank()) return null;
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unsupported time grouping: " + raw, e);
    }
  }
}
