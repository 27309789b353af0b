package io.mesabi.analytics.mapping;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.SQLException;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Converts driver values into transport-safe ones.
 * <ul>
 *   <li>{@link Long}, {@link BigInteger}, {@link BigDecimal} and numeric text become {@code double}</li>
 *   <li>temporal values become ISO-8601 text; offsets are kept, a bare {@link java.sql.Timestamp} is
 *   wall-clock time with no offset</li>
 *   <li>arrays and collections become lists, maps are walked; an empty map becomes null</li>
 * </ul>
 * Dialects extend {@link #normalizeOther(Object)} for driver-specific types.
 */
public class ValueNormalizer {
  private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

  public Map<String, Object> normalizeRow(Map<String, Object> row) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : row.entrySet()) out.put(e.getKey(), normalize(e.getValue()));
    return out;
  }

  public Object normalize(Object v) {
    if (v == null) return null;
    if (v instanceof Long l) return l.doubleValue();
    if (v instanceof BigInteger bi) return bi.doubleValue();
    if (v instanceof BigDecimal bd) return bd.doubleValue();
    if (v instanceof String s) return NUMERIC.matcher(s).matches() ? Double.parseDouble(s) : s;

    if (v instanceof java.sql.Timestamp ts) return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(ts.toLocalDateTime());
    if (v instanceof java.sql.Date d) return d.toLocalDate().toString();
    if (v instanceof java.sql.Time t) return t.toLocalTime().toString();
    if (v instanceof LocalDateTime ldt) return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(ldt);
    if (v instanceof OffsetDateTime odt) return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt);
    if (v instanceof ZonedDateTime zdt) return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(zdt.toOffsetDateTime());
    if (v instanceof Instant i) return i.toString();
    if (v instanceof LocalDate ld) return ld.toString();
    if (v instanceof LocalTime lt) return lt.toString();
    if (v instanceof java.util.Date d) return d.toInstant().toString();

    if (v instanceof java.sql.Array a) {
      try {
        return normalize(a.getArray());
      } catch (SQLException e) {
        throw new RuntimeException(e);
      }
    }
    if (v instanceof Object[] arr) return normalizeAll(Arrays.asList(arr));
    if (v instanceof Collection<?> c) return normalizeAll(c);
    if (v instanceof Map<?, ?> m) {
      // the driver hands back an empty object for values it cannot represent
      if (m.isEmpty()) return null;
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), normalize(e.getValue()));
      return out;
    }
    return normalizeOther(v);
  }

  /** Hook for driver-specific value types. Default returns the value unchanged. */
  protected Object normalizeOther(Object v) {
    return v;
  }

  private List<Object> normalizeAll(Collection<?> values) {
    List<Object> out = new ArrayList<>(values.size());
    for (Object o : values) out.add(normalize(o));
    return out;
  }
}
