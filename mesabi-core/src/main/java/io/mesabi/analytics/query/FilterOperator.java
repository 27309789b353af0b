package io.mesabi.analytics.query;

import java.util.Locale;

public enum FilterOperator {
  EQ("="),
  NE("!="),
  GT(">"),
  LT("<"),
  GE(">="),
  LE("<="),
  BETWEEN("between"),
  IN("in"),
  LIKE("like"),
  CONTAINS("contains");

  private final String symbol;

  FilterOperator(String symbol) {
    this.symbol = symbol;
  }

  /** The DSL spelling, e.g. {@code ">="} or {@code "between"}. */
  public String symbol() { return symbol; }

  public boolean isRelational() {
    return this == EQ || this == NE || this == GT || this == LT || this == GE || this == LE;
  }

  public static FilterOperator fromWire(String raw) {
    if (raw == null) throw new QueryValidationException("Missing filter operator");
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (FilterOperator op : values()) {
      if (op.symbol.equals(s)) return op;
    }
    throw new QueryValidationException("Unsupported operator: " + raw);
  }
}
