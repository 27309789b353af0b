package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.DatePart;
import io.mesabi.analytics.jdbc.bind.JdbcBinder;
import io.mesabi.analytics.mapping.ValueNormalizer;
import io.mesabi.analytics.query.TimeGrouping;

/** Store-specific SQL spelling plus the matching binder and result normalizer. */
public interface SqlDialect {
  String id();

  String quoteIdent(String ident);

  /** Temporal bucket, e.g. {@code DATE_TRUNC('day', sales.created_at)}. */
  String dateTrunc(TimeGrouping grouping, String expr);

  /** Part extraction, e.g. {@code EXTRACT(DOW FROM sales.created_at)}. */
  String extract(DatePart part, String expr);

  /** "{@code expr} contains every element of the bound array". */
  String arrayContains(String expr, String placeholder);

  String limit(int n);

  JdbcBinder binder();

  ValueNormalizer valueNormalizer();
}
