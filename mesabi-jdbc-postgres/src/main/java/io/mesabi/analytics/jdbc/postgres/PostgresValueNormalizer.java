package io.mesabi.analytics.jdbc.postgres;

import io.mesabi.analytics.mapping.ValueNormalizer;
import org.postgresql.util.PGobject;

/** Unwraps driver objects (intervals, json, enums) to their text form; a null-valued object becomes null. */
public final class PostgresValueNormalizer extends ValueNormalizer {
  @Override
  protected Object normalizeOther(Object v) {
    if (v instanceof PGobject pg) {
      String value = pg.getValue();
      return value == null ? null : normalize(value);
    }
    return v;
  }
}
