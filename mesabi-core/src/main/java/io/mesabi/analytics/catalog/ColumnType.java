package io.mesabi.analytics.catalog;

/** Column types the catalog declares; drives bind coercion and operator checks. */
public enum ColumnType {
  INTEGER,
  DECIMAL,
  TEXT,
  BOOLEAN,
  DATE,
  TIMESTAMP,
  TEXT_ARRAY;

  public boolean isNumeric() { return this == INTEGER || this == DECIMAL; }
  public boolean isTemporal() { return this == DATE || this == TIMESTAMP; }
}
