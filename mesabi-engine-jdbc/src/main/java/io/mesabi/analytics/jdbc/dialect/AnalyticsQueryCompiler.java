package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.DisplayColumn;
import io.mesabi.analytics.catalog.JoinDef;
import io.mesabi.analytics.catalog.SchemaCatalog;
import io.mesabi.analytics.catalog.SubjectSchema;
import io.mesabi.analytics.jdbc.SqlStatement;
import io.mesabi.analytics.query.Dimension;
import io.mesabi.analytics.query.Measure;
import io.mesabi.analytics.query.QueryRequest;
import io.mesabi.analytics.query.QueryValidationException;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Compiles a {@link QueryRequest} into one SQL statement.
 * <p>
 * Clause order is fixed: SELECT, FROM, JOINs, WHERE, GROUP BY, ORDER BY, LIMIT, one per line. Pure and thread-safe;
 * every failure is a {@link QueryValidationException} raised before any SQL reaches the store.
 */
public final class AnalyticsQueryCompiler {
  public static final int DEFAULT_MAX_LIMIT = 10_000;

  private static final Pattern ALIAS = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final SchemaCatalog catalog;
  private final SqlDialect dialect;
  private final int maxLimit;

  public AnalyticsQueryCompiler(SchemaCatalog catalog, SqlDialect dialect, int maxLimit) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    if (maxLimit < 1) throw new IllegalArgumentException("maxLimit must be >= 1");
    this.maxLimit = maxLimit;
  }

  public AnalyticsQueryCompiler(SchemaCatalog catalog, SqlDialect dialect) {
    this(catalog, dialect, DEFAULT_MAX_LIMIT);
  }

  public SqlDialect dialect() { return dialect; }
  public int maxLimit() { return maxLimit; }

  public SqlStatement compile(QueryRequest q) {
    Objects.requireNonNull(q, "query");
    if (q.subject() == null) throw new QueryValidationException("subject is required");
    SubjectSchema schema = catalog.schema(q.subject());

    List<String> dimensionFields = new ArrayList<>();
    for (Dimension d : q.dimensions()) dimensionFields.add(d.field());

    List<DimensionExpressions.Column> dims = DimensionExpressions.of(schema, dialect, q.dimensions());
    List<DisplayColumn> displays = schema.displayColumnsFor(dimensionFields);
    Map<String, String> outputAliases = outputAliases(q.measures(), dims, displays);

    RenderCtx ctx = new RenderCtx();
    String select = SelectRenderer.render(schema, dialect, q.measures(), dims, displays);
    String where = WhereRenderer.render(schema, dialect, q.timeRange(), q.filters(), ctx);
    String groupBy = GroupByRenderer.render(dims, displays);
    String orderBy = OrderByRenderer.render(schema, dialect, q.orderBy(), outputAliases);
    String limit = (q.limit() == null) ? "" : dialect.limit(checkLimit(q.limit()));

    List<JoinDef> joins = catalog.requiredJoins(q);

    StringBuilder sql = new StringBuilder(select);
    sql.append("\nFROM ").append(schema.baseTable());
    for (String j : JoinRenderer.render(joins)) sql.append('\n').append(j);
    appendLine(sql, where);
    appendLine(sql, groupBy);
    appendLine(sql, orderBy);
    appendLine(sql, limit);

    List<String> aliases = new ArrayList<>(joins.size());
    for (JoinDef j : joins) aliases.add(j.alias());
    return new SqlStatement(sql.toString(), ctx.binds(), aliases);
  }

  private int checkLimit(int limit) {
    if (limit < 1 || limit > maxLimit) {
      throw new QueryValidationException("limit must be between 1 and " + maxLimit + ", got " + limit);
    }
    return limit;
  }

  /** Names an ORDER BY may reference, mapped to the SELECT alias; duplicates or malformed aliases are rejected. */
  private static Map<String, String> outputAliases(List<Measure> measures,
                                                   List<DimensionExpressions.Column> dims,
                                                   List<DisplayColumn> displays) {
    Map<String, String> out = new LinkedHashMap<>();
    Set<String> seen = new LinkedHashSet<>();
    if (measures.isEmpty()) seen.add(SelectRenderer.DEFAULT_COUNT_ALIAS);
    for (Measure m : measures) {
      if (!ALIAS.matcher(m.name()).matches()) {
        throw new QueryValidationException("Invalid measure alias: '" + m.name() + "'");
      }
      requireUnique(seen, m.name());
    }
    for (DimensionExpressions.Column c : dims) requireUnique(seen, c.alias());
    for (DisplayColumn dc : displays) requireUnique(seen, dc.alias());

    for (String s : seen) out.put(s, s);
    // ordering by a bucketed field means ordering by its bucket
    for (DimensionExpressions.Column c : dims) {
      if (!c.alias().equals(c.dimension().field())) out.putIfAbsent(c.dimension().field(), c.alias());
    }
    return out;
  }

  private static void requireUnique(Set<String> seen, String alias) {
    if (!seen.add(alias)) throw new QueryValidationException("Duplicate output alias: '" + alias + "'");
  }

  private static void appendLine(StringBuilder sql, String clause) {
    if (clause != null && !clause.isEmpty()) sql.append('\n').append(clause);
  }
}
