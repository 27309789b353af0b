package io.mesabi.analytics.jdbc.postgres;

import io.mesabi.analytics.catalog.DatePart;
import io.mesabi.analytics.jdbc.dialect.AbstractSqlDialect;
import io.mesabi.analytics.query.TimeGrouping;

/**
 * Postgres dialect.
 * <p>
 * Keeps only Postgres-specific spelling; clause rendering lives in
 * {@link io.mesabi.analytics.jdbc.dialect.AnalyticsQueryCompiler}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public PostgresDialect() {
    super(new PostgresBinder(), new PostgresValueNormalizer());
  }

  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String dateTrunc(TimeGrouping grouping, String expr) {
    return "DATE_TRUNC('" + grouping.unit() + "', " + expr + ")";
  }

  @Override
  public String extract(DatePart part, String expr) {
    String field = switch (part) {
      case DAY_OF_WEEK -> "DOW";
      case HOUR -> "HOUR";
    };
    return "EXTRACT(" + field + " FROM " + expr + ")";
  }

  /** Array containment: {@code col @> ARRAY[...]}, with the full right-hand side bound as one text[]. */
  @Override
  public String arrayContains(String expr, String placeholder) {
    return expr + " @> " + placeholder;
  }
}
