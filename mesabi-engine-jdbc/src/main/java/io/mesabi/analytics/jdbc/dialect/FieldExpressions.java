package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.ColumnType;
import io.mesabi.analytics.catalog.DatePart;
import io.mesabi.analytics.catalog.FieldDef;
import io.mesabi.analytics.catalog.SubjectSchema;

/** Resolves a DSL field to its SQL expression: a derived date part, or the catalog's qualified column. */
final class FieldExpressions {
  private FieldExpressions() {}

  static FieldDef resolve(SubjectSchema schema, SqlDialect dialect, String field) {
    DatePart part = schema.derivedDimension(field);
    if (part != null) {
      FieldDef temporal = schema.temporal();
      return new FieldDef(field, dialect.extract(part, temporal.expression()), ColumnType.INTEGER, temporal.joinAlias());
    }
    return schema.qualify(field);
  }
}
