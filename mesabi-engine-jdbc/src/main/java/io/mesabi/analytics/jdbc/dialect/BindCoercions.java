package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.ColumnType;
import io.mesabi.analytics.catalog.DatePart;
import io.mesabi.analytics.compile.Bind;
import io.mesabi.analytics.query.QueryValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Coerces request values to the column type they are compared against.
 * Values that do not parse fully are rejected rather than truncated.
 */
public final class BindCoercions {
  private BindCoercions() {}

  public static Bind bind(String field, ColumnType type, Object value) {
    return new Bind(coerce(field, type, value), type);
  }

  public static Object coerce(String field, ColumnType type, Object value) {
    if (value == null) return null;
    return switch (type) {
      case INTEGER -> toLong(field, value);
      case DECIMAL -> toDecimal(field, value);
      case TEXT -> (value instanceof String s) ? s : scalarText(field, value);
      case BOOLEAN -> toBoolean(field, value);
      case DATE -> toDate(field, value);
      case TIMESTAMP -> toTimestamp(field, value);
      case TEXT_ARRAY -> toTextList(field, value);
    };
  }

  /** Request-side value of a date part (e.g. day_of_week 1..7), range-checked and mapped to the store's numbering. */
  public static int datePart(String field, DatePart part, Object value) {
    if (value == null) throw new QueryValidationException("Field '" + field + "' requires a value");
    long v = toLong(field, value);
    if (v < part.min() || v > part.max()) {
      throw new QueryValidationException(
          "Value " + value + " for field '" + field + "' must be between " + part.min() + " and " + part.max());
    }
    return part.toStoreValue((int) v);
  }

  @SuppressWarnings("unchecked")
  public static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Object>) l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }

  private static long toLong(String field, Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof BigInteger || v instanceof BigDecimal) {
      try {
        return new BigDecimal(v.toString()).longValueExact();
      } catch (ArithmeticException e) {
        throw invalid(field, "integer", v);
      }
    }
    if (v instanceof Number n) {
      double d = n.doubleValue();
      // 2^63 itself is out of range; -2^63 is not
      if (d == Math.rint(d) && d >= Long.MIN_VALUE && d < 0x1p63) return (long) d;
      throw invalid(field, "integer", v);
    }
    if (v instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        throw invalid(field, "integer", v);
      }
    }
    throw invalid(field, "integer", v);
  }

  private static BigDecimal toDecimal(String field, Object v) {
    if (v instanceof BigDecimal bd) return bd;
    try {
      if (v instanceof Number n) return new BigDecimal(n.toString());
      if (v instanceof String s) return new BigDecimal(s.trim());
    } catch (NumberFormatException e) {
      throw invalid(field, "decimal", v);
    }
    throw invalid(field, "decimal", v);
  }

  private static Boolean toBoolean(String field, Object v) {
    if (v instanceof Boolean b) return b;
    if (v instanceof String s) {
      String t = s.trim().toLowerCase(Locale.ROOT);
      if (t.equals("true")) return Boolean.TRUE;
      if (t.equals("false")) return Boolean.FALSE;
    }
    throw invalid(field, "boolean", v);
  }

  private static LocalDate toDate(String field, Object v) {
    if (v instanceof LocalDate d) return d;
    if (v instanceof String s) {
      Object t = parseTemporal(field, s);
      if (t instanceof LocalDateTime ldt) return ldt.toLocalDate();
      return ((OffsetDateTime) t).toLocalDate();
    }
    throw invalid(field, "date", v);
  }

  private static Object toTimestamp(String field, Object v) {
    if (v instanceof LocalDateTime || v instanceof OffsetDateTime) return v;
    if (v instanceof LocalDate d) return d.atStartOfDay();
    if (v instanceof String s) return parseTemporal(field, s);
    throw invalid(field, "timestamp", v);
  }

  /** ISO date (start of day), local date-time, or date-time with offset; a space may stand in for the 'T'. */
  private static Object parseTemporal(String field, String raw) {
    String s = raw.trim();
    if (s.length() > 10 && s.charAt(10) == ' ') s = s.substring(0, 10) + 'T' + s.substring(11).trim();
    try {
      if (s.length() == 10) return LocalDate.parse(s).atStartOfDay();
      if (s.endsWith("Z") || s.matches(".*[+-]\\d{2}:\\d{2}$")) return OffsetDateTime.parse(s);
      return LocalDateTime.parse(s);
    } catch (DateTimeParseException e) {
      throw invalid(field, "timestamp", raw);
    }
  }

  private static List<String> toTextList(String field, Object v) {
    List<String> out = new ArrayList<>();
    for (Object o : toList(v)) {
      if (o == null) throw invalid(field, "text array", v);
      out.add(o instanceof String s ? s : scalarText(field, o));
    }
    return out;
  }

  private static String scalarText(String field, Object v) {
    if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
    throw invalid(field, "text", v);
  }

  private static QueryValidationException invalid(String field, String what, Object v) {
    return new QueryValidationException("Invalid " + what + " value for field '" + field + "': " + v);
  }
}
