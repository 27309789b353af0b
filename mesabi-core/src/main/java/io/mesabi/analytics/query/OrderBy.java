package io.mesabi.analytics.query;

import java.util.Locale;
import java.util.Objects;

public record OrderBy(String field, Direction direction) {
  public OrderBy {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    public static Direction fromWire(String raw) {
      if (raw == null || raw.isBlank()) return ASC;
      try {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new QueryValidationException("Unsupported order direction: " + raw, e);
      }
    }
  }
}
