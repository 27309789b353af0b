package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.SubjectSchema;
import io.mesabi.analytics.query.OrderBy;

import java.util.Map;

/**
 * ORDER BY a single target. Output aliases win over catalog fields; a bucketed dimension's field orders by its
 * bucket alias.
 */
final class OrderByRenderer {
  private OrderByRenderer() {}

  /**
   * @param outputAliases request-visible names mapped to the SELECT alias they order by
   */
  static String render(SubjectSchema schema, SqlDialect dialect, OrderBy orderBy, Map<String, String> outputAliases) {
    if (orderBy == null) return "";
    String alias = outputAliases.get(orderBy.field());
    String target = (alias != null)
        ? dialect.quoteIdent(alias)
        : FieldExpressions.resolve(schema, dialect, orderBy.field()).expression();
    return "ORDER BY " + target + " " + orderBy.direction().name();
  }
}
