package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.DisplayColumn;
import io.mesabi.analytics.catalog.FieldDef;
import io.mesabi.analytics.catalog.SubjectSchema;
import io.mesabi.analytics.query.Aggregation;
import io.mesabi.analytics.query.Measure;
import io.mesabi.analytics.query.QueryValidationException;

import java.util.ArrayList;
import java.util.List;

/** SELECT list: measures, then dimensions, then display-name columns. */
final class SelectRenderer {
  static final String DEFAULT_COUNT_ALIAS = "count";

  private SelectRenderer() {}

  static String render(SubjectSchema schema, SqlDialect dialect, List<Measure> measures,
                       List<DimensionExpressions.Column> dimensions, List<DisplayColumn> displays) {
    List<String> items = new ArrayList<>();
    if (measures.isEmpty()) {
      items.add("COUNT(*) AS " + dialect.quoteIdent(DEFAULT_COUNT_ALIAS));
    }
    for (Measure m : measures) {
      items.add(aggregate(schema, dialect, m) + " AS " + dialect.quoteIdent(m.name()));
    }
    for (DimensionExpressions.Column c : dimensions) {
      items.add(c.expression() + " AS " + dialect.quoteIdent(c.alias()));
    }
    for (DisplayColumn dc : displays) {
      items.add(dc.expression() + " AS " + dialect.quoteIdent(dc.alias()));
    }
    return "SELECT " + String.join(", ", items);
  }

  private static String aggregate(SubjectSchema schema, SqlDialect dialect, Measure m) {
    if (Measure.ALL_ROWS.equals(m.field())) {
      if (m.aggregation() != Aggregation.COUNT) {
        throw new QueryValidationException("Only count can aggregate over '*' (measure '" + m.name() + "')");
      }
      return "COUNT(*)";
    }
    FieldDef f = FieldExpressions.resolve(schema, dialect, m.field());
    return switch (m.aggregation()) {
      case DISTINCT_COUNT -> "COUNT(DISTINCT " + f.expression() + ")";
      case SUM, AVG -> {
        if (!f.type().isNumeric()) {
          throw new QueryValidationException(
              m.aggregation().wireName() + " requires a numeric field, got '" + m.field() + "' (measure '" + m.name() + "')");
        }
        yield m.aggregation().name() + "(" + f.expression() + ")";
      }
      case COUNT, MIN, MAX -> m.aggregation().name() + "(" + f.expression() + ")";
    };
  }
}
