package io.mesabi.analytics.query;

import java.util.Objects;

/**
 * Inclusive bounds on the subject's canonical temporal column, as ISO-8601 text.
 * <p>
 * A date without a time binds as midnight at the start of that day, for {@code to} as well as {@code from}:
 * {@code to = "2025-01-31"} excludes everything after 2025-01-31T00:00. Pass {@code "2025-01-31T23:59:59"} or
 * the next day to cover the whole day.
 */
public record TimeRange(String from, String to) {
  public TimeRange {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }
}
