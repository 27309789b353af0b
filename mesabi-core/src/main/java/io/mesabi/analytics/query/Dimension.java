package io.mesabi.analytics.query;

import java.util.Objects;

/** A grouping key. {@code name} is informational; {@code grouping} is null unless the field is bucketed by time. */
public record Dimension(String name, String field, TimeGrouping grouping) {
  public Dimension {
    Objects.requireNonNull(field, "field");
    name = (name == null) ? field : name;
  }

  public static Dimension of(String field) {
    return new Dimension(field, field, null);
  }

  public static Dimension bucketed(String field, TimeGrouping grouping) {
    return new Dimension(field, field, Objects.requireNonNull(grouping, "grouping"));
  }
}
