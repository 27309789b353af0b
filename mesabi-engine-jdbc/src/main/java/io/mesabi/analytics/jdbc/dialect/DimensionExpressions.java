package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.FieldDef;
import io.mesabi.analytics.catalog.SubjectSchema;
import io.mesabi.analytics.query.Dimension;
import io.mesabi.analytics.query.QueryValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes each dimension's grouping expression once; SELECT and GROUP BY both render from this list,
 * so the two clauses cannot drift apart.
 */
final class DimensionExpressions {
  private DimensionExpressions() {}

  record Column(Dimension dimension, String expression, String alias) {}

  static List<Column> of(SubjectSchema schema, SqlDialect dialect, List<Dimension> dimensions) {
    List<Column> out = new ArrayList<>(dimensions.size());
    for (Dimension d : dimensions) {
      if (d.grouping() == null) {
        out.add(new Column(d, FieldExpressions.resolve(schema, dialect, d.field()).expression(), d.field()));
        continue;
      }
      if (schema.derivedDimension(d.field()) != null) {
        throw new QueryValidationException("Field '" + d.field() + "' cannot be bucketed by " + d.grouping().unit());
      }
      FieldDef f = schema.qualify(d.field());
      if (!f.type().isTemporal()) {
        throw new QueryValidationException("Time grouping requires a temporal field, got '" + d.field() + "'");
      }
      String unit = d.grouping().unit();
      out.add(new Column(d, dialect.dateTrunc(d.grouping(), f.expression()), d.field() + "_" + unit));
    }
    return out;
  }
}
