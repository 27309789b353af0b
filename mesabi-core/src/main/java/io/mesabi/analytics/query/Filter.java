package io.mesabi.analytics.query;

import java.util.Objects;

/**
 * A single conjunctive condition. {@code value} is whatever the wire carried: a scalar, or a list for
 * {@code between}/{@code in}.
 */
public record Filter(String field, FilterOperator op, Object value) {
  public Filter {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(op, "op");
  }

  public static Filter of(String field, FilterOperator op, Object value) {
    return new Filter(field, op, value);
  }

  public static Filter eq(String field, Object value) { return new Filter(field, FilterOperator.EQ, value); }
}
