package io.mesabi.analytics.jdbc;

import io.mesabi.analytics.catalog.ColumnType;
import io.mesabi.analytics.compile.Bind;
import io.mesabi.analytics.jdbc.dialect.BindCoercions;
import io.mesabi.analytics.jdbc.dialect.RenderCtx;
import io.mesabi.analytics.jdbc.dialect.SqlDialect;
import io.mesabi.analytics.query.QueryValidationException;
import io.mesabi.analytics.query.TimeRange;
import io.mesabi.analytics.result.ProductCombination;

import java.util.Map;
import java.util.Objects;

/**
 * "Frequently bought together": product pairs sharing a sale, counted once per unordered pair.
 * <p>
 * The self-join with {@code ps1.product_id < ps2.product_id} drops self-pairs and mirrored duplicates, so every
 * returned pair has {@code productIdA < productIdB}.
 */
public final class ProductCombinationQuery {
  static final String PRODUCT_A = "product_id_a";
  static final String PRODUCT_B = "product_id_b";
  static final String TIMES_TOGETHER = "times_together";
  static final String TOTAL_REVENUE = "total_revenue";
  static final String AVERAGE_TICKET = "average_ticket";

  private final SqlDialect dialect;

  public ProductCombinationQuery(SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public SqlStatement compile(int minOccurrences, TimeRange timeRange) {
    if (minOccurrences < 1) {
      throw new QueryValidationException("minOccurrences must be >= 1, got " + minOccurrences);
    }
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder();
    sql.append("SELECT ps1.product_id AS ").append(q(PRODUCT_A))
        .append(", ps2.product_id AS ").append(q(PRODUCT_B))
        .append(", COUNT(*) AS ").append(q(TIMES_TOGETHER))
        .append(", SUM(s.total_amount) AS ").append(q(TOTAL_REVENUE))
        .append(", AVG(s.total_amount) AS ").append(q(AVERAGE_TICKET));
    sql.append("\nFROM product_sales ps1");
    sql.append("\nJOIN product_sales ps2 ON ps1.sale_id = ps2.sale_id AND ps1.product_id < ps2.product_id");
    sql.append("\nJOIN sales s ON s.id = ps1.sale_id");
    if (timeRange != null) {
      String from = ctx.add(BindCoercions.bind("created_at", ColumnType.TIMESTAMP, timeRange.from()));
      String to = ctx.add(BindCoercions.bind("created_at", ColumnType.TIMESTAMP, timeRange.to()));
      sql.append("\nWHERE s.created_at >= ").append(from).append(" AND s.created_at <= ").append(to);
    }
    sql.append("\nGROUP BY ps1.product_id, ps2.product_id");
    sql.append("\nHAVING COUNT(*) >= ").append(ctx.add(new Bind((long) minOccurrences, ColumnType.INTEGER)));
    sql.append("\nORDER BY COUNT(*) DESC, ps1.product_id ASC, ps2.product_id ASC");
    return new SqlStatement(sql.toString(), ctx.binds());
  }

  /** Maps a normalized row (numbers already widened to double). */
  public static ProductCombination toCombination(Map<String, Object> row) {
    return new ProductCombination(
        (long) number(row, PRODUCT_A),
        (long) number(row, PRODUCT_B),
        (long) number(row, TIMES_TOGETHER),
        number(row, TOTAL_REVENUE),
        number(row, AVERAGE_TICKET));
  }

  private static double number(Map<String, Object> row, String column) {
    Object v = row.get(column);
    if (v == null) return 0d;
    if (v instanceof Number n) return n.doubleValue();
    throw new IllegalStateException("Column " + column + " is not numeric: " + v.getClass().getName());
  }

  private String q(String alias) {
    return dialect.quoteIdent(alias);
  }
}
