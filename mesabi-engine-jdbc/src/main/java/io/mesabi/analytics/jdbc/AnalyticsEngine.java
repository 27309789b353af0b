package io.mesabi.analytics.jdbc;

import io.mesabi.analytics.error.AnalyticsException;
import io.mesabi.analytics.error.ErrorKind;
import io.mesabi.analytics.jdbc.dialect.AnalyticsQueryCompiler;
import io.mesabi.analytics.mapping.ValueNormalizer;
import io.mesabi.analytics.query.QueryRequest;
import io.mesabi.analytics.query.TimeRange;
import io.mesabi.analytics.result.ProductCombination;
import io.mesabi.analytics.result.QueryMetadata;
import io.mesabi.analytics.result.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Compile, execute, normalize. Compilation errors surface as {@code BAD_REQUEST} before any SQL runs; anything that
 * fails afterwards becomes a single {@code QUERY_EXECUTION_FAILED} error and no partial result is returned.
 */
public final class AnalyticsEngine {
  private static final Logger log = LoggerFactory.getLogger(AnalyticsEngine.class);

  private final AnalyticsQueryCompiler compiler;
  private final ProductCombinationQuery combinations;
  private final QueryExecutor executor;
  private final ValueNormalizer normalizer;

  public AnalyticsEngine(AnalyticsQueryCompiler compiler, QueryExecutor executor) {
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.combinations = new ProductCombinationQuery(compiler.dialect());
    this.normalizer = compiler.dialect().valueNormalizer();
  }

  public QueryResult<Map<String, Object>> execute(QueryRequest q) {
    SqlStatement ss = compiler.compile(q);
    return run("query", ss, Function.identity());
  }

  public QueryResult<ProductCombination> productCombinations(int minOccurrences, TimeRange timeRange) {
    SqlStatement ss = combinations.compile(minOccurrences, timeRange);
    return run("product_combinations", ss, ProductCombinationQuery::toCombination);
  }

  private <T> QueryResult<T> run(String op, SqlStatement ss, Function<Map<String, Object>, T> mapper) {
    long start = System.nanoTime();
    try {
      List<Map<String, Object>> rows = executor.query(ss);
      List<T> out = new ArrayList<>(rows.size());
      for (Map<String, Object> row : rows) out.add(mapper.apply(normalizer.normalizeRow(row)));
      long ms = (System.nanoTime() - start) / 1_000_000;
      log.debug("mesabi.engine_done op={} rows={} durationMs={}", op, out.size(), ms);
      return new QueryResult<>(out, QueryMetadata.of(out.size(), ms, ss.sql()));
    } catch (RuntimeException e) {
      log.error("mesabi.engine_failed op={} sql={}", op, ss.sql(), e);
      throw new AnalyticsException(ErrorKind.QUERY_EXECUTION_FAILED, "Query execution failed: " + messageOf(e), e);
    }
  }

  /** Driver message when there is one, otherwise the first non-empty message in the cause chain. */
  static String messageOf(Throwable e) {
    String first = null;
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException && t.getMessage() != null) return t.getMessage();
      if (first == null && t.getMessage() != null) first = t.getMessage();
      if (t.getCause() == t) break;
    }
    return first == null ? e.getClass().getSimpleName() : first;
  }
}
