package io.mesabi.analytics.query;

import java.util.Objects;

/** An aggregated output column. {@code name} is the output alias and must be unique per request. */
public record Measure(String name, Aggregation aggregation, String field) {
  /** Field value that stands for "all rows" in {@code COUNT(*)}. */
  public static final String ALL_ROWS = "*";

  public Measure {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(aggregation, "aggregation");
    Objects.requireNonNull(field, "field");
  }

  public static Measure of(String name, Aggregation aggregation, String field) {
    return new Measure(name, aggregation, field);
  }
}
