package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.ColumnType;
import io.mesabi.analytics.catalog.DerivedFilter;
import io.mesabi.analytics.catalog.FieldDef;
import io.mesabi.analytics.catalog.SubjectSchema;
import io.mesabi.analytics.compile.Bind;
import io.mesabi.analytics.query.Filter;
import io.mesabi.analytics.query.FilterOperator;
import io.mesabi.analytics.query.QueryValidationException;
import io.mesabi.analytics.query.TimeRange;

import java.util.ArrayList;
import java.util.List;

/**
 * WHERE clause: the time range first, then one condition per filter, joined with AND.
 * Every value is bound; only catalog expressions reach the SQL text.
 */
final class WhereRenderer {
  private WhereRenderer() {}

  static String render(SubjectSchema schema, SqlDialect dialect, TimeRange timeRange, List<Filter> filters,
                       RenderCtx ctx) {
    List<String> conditions = new ArrayList<>();
    if (timeRange != null) {
      FieldDef t = schema.temporal();
      conditions.add(t.expression() + " >= " + ctx.add(BindCoercions.bind(t.name(), t.type(), timeRange.from())));
      conditions.add(t.expression() + " <= " + ctx.add(BindCoercions.bind(t.name(), t.type(), timeRange.to())));
    }
    for (Filter f : filters) {
      DerivedFilter df = schema.derivedFilter(f.field());
      conditions.add(df != null
          ? derivedCondition(schema, dialect, df, f, ctx)
          : condition(FieldExpressions.resolve(schema, dialect, f.field()), dialect, f, ctx));
    }
    return conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions);
  }

  private static String derivedCondition(SubjectSchema schema, SqlDialect dialect, DerivedFilter df, Filter f,
                                         RenderCtx ctx) {
    String expr = dialect.extract(df.part(), schema.temporal().expression());
    FilterOperator op = (df.fixedOperator() != null) ? df.fixedOperator() : f.op();
    return switch (op) {
      case EQ, NE, GE, LE -> expr + " " + relational(op) + " "
          + ctx.add(new Bind(BindCoercions.datePart(f.field(), df.part(), f.value()), ColumnType.INTEGER));
      case IN -> {
        List<String> ph = new ArrayList<>();
        for (Object v : BindCoercions.toList(f.value())) {
          ph.add(ctx.add(new Bind(BindCoercions.datePart(f.field(), df.part(), v), ColumnType.INTEGER)));
        }
        yield ph.isEmpty() ? "FALSE" : expr + " IN (" + String.join(", ", ph) + ")";
      }
      default -> throw unsupported(op, f.field());
    };
  }

  private static String condition(FieldDef field, SqlDialect dialect, Filter f, RenderCtx ctx) {
    String expr = field.expression();
    FilterOperator op = f.op();
    Object value = f.value();

    if (field.type() == ColumnType.TEXT_ARRAY && op != FilterOperator.CONTAINS) throw unsupported(op, f.field());

    return switch (op) {
      case EQ -> (value == null) ? expr + " IS NULL" : scalar(field, expr, op, value, ctx);
      case NE -> (value == null) ? expr + " IS NOT NULL" : scalar(field, expr, op, value, ctx);
      case GT, LT, GE, LE -> {
        if (value == null) throw new QueryValidationException("Operator '" + op.symbol() + "' requires a value");
        yield scalar(field, expr, op, value, ctx);
      }
      case BETWEEN -> {
        List<Object> range = BindCoercions.toList(value);
        if (range.size() != 2 || range.get(0) == null || range.get(1) == null) {
          throw new QueryValidationException("Operator 'between' requires a two-element value for field '" + f.field() + "'");
        }
        String lo = ctx.add(BindCoercions.bind(f.field(), field.type(), range.get(0)));
        String hi = ctx.add(BindCoercions.bind(f.field(), field.type(), range.get(1)));
        yield expr + " BETWEEN " + lo + " AND " + hi;
      }
      case IN -> {
        List<String> ph = new ArrayList<>();
        for (Object v : BindCoercions.toList(value)) {
          ph.add(ctx.add(BindCoercions.bind(f.field(), field.type(), v)));
        }
        yield ph.isEmpty() ? "FALSE" : expr + " IN (" + String.join(", ", ph) + ")";
      }
      case LIKE -> {
        if (field.type() != ColumnType.TEXT || value == null) throw unsupported(op, f.field());
        yield expr + " LIKE " + ctx.add(new Bind("%" + BindCoercions.coerce(f.field(), ColumnType.TEXT, value) + "%",
            ColumnType.TEXT));
      }
      case CONTAINS -> {
        if (field.type() != ColumnType.TEXT_ARRAY) throw unsupported(op, f.field());
        List<Object> values = BindCoercions.toList(value);
        // every array contains the empty array
        if (values.isEmpty()) yield "TRUE";
        yield dialect.arrayContains(expr, ctx.add(BindCoercions.bind(f.field(), ColumnType.TEXT_ARRAY, values)));
      }
    };
  }

  private static String scalar(FieldDef field, String expr, FilterOperator op, Object value, RenderCtx ctx) {
    return expr + " " + relational(op) + " " + ctx.add(BindCoercions.bind(field.name(), field.type(), value));
  }

  private static String relational(FilterOperator op) {
    return op == FilterOperator.NE ? "<>" : op.symbol();
  }

  private static QueryValidationException unsupported(FilterOperator op, String field) {
    return new QueryValidationException("Operator '" + op.symbol() + "' is not supported for field '" + field + "'");
  }
}
