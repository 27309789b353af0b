package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.jdbc.bind.DefaultJdbcBinder;
import io.mesabi.analytics.jdbc.bind.JdbcBinder;
import io.mesabi.analytics.mapping.ValueNormalizer;
import io.mesabi.analytics.query.QueryValidationException;

/**
 * JDBC-generic dialect base.
 * <p>
 * DB-specific dialects override hooks for quoting, temporal functions and array containment.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  private final JdbcBinder binder;
  private final ValueNormalizer normalizer;

  protected AbstractSqlDialect(JdbcBinder binder, ValueNormalizer normalizer) {
    this.binder = (binder == null) ? new DefaultJdbcBinder() : binder;
    this.normalizer = (normalizer == null) ? new ValueNormalizer() : normalizer;
  }

  protected AbstractSqlDialect() {
    this(null, null);
  }

  /** Default throws; dialects with array types override. */
  @Override
  public String arrayContains(String expr, String placeholder) {
    throw new QueryValidationException("Operator 'contains' is not supported by dialect: " + id());
  }

  @Override
  public String limit(int n) {
    return "LIMIT " + n;
  }

  @Override public JdbcBinder binder() { return binder; }
  @Override public ValueNormalizer valueNormalizer() { return normalizer; }
}
