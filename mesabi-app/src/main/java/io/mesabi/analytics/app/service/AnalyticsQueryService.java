package io.mesabi.analytics.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mesabi.analytics.jdbc.AnalyticsEngine;
import io.mesabi.analytics.query.QueryRequest;
import io.mesabi.analytics.query.QueryValidationException;
import io.mesabi.analytics.query.TimeRange;
import io.mesabi.analytics.result.ProductCombination;
import io.mesabi.analytics.result.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;

/** Entry points for whatever transport fronts the analytics engine. */
@Service
public final class AnalyticsQueryService {
  private static final Logger log = LoggerFactory.getLogger(AnalyticsQueryService.class);

  private final AnalyticsEngine engine;
  private final ObjectMapper json;

  public AnalyticsQueryService(AnalyticsEngine engine, ObjectMapper json) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.json = Objects.requireNonNull(json, "json");
  }

  public QueryResult<Map<String, Object>> executeQuery(QueryRequest request) {
    if (request == null) throw new QueryValidationException("query request is required");
    log.debug("mesabi.service op=query subject={} measures={} dimensions={} filters={}",
        request.subject(), request.measures().size(), request.dimensions().size(), request.filters().size());
    QueryResult<Map<String, Object>> result = engine.execute(request);
    log.info("mesabi.service op=query subject={} rows={} durationMs={}",
        request.subject(), result.metadata().totalRows(), result.metadata().executionTimeMs());
    return result;
  }

  /** Parses the JSON wire form, then runs {@link #executeQuery(QueryRequest)}. */
  public QueryResult<Map<String, Object>> executeQuery(String requestJson) {
    QueryRequest request;
    try {
      request = json.readValue(requestJson, QueryRequest.class);
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof QueryValidationException qve) throw qve;
      throw new QueryValidationException("Malformed query request: " + e.getOriginalMessage(), e);
    }
    return executeQuery(request);
  }

  /**
   * Product pairs bought together at least {@code minOccurrences} times, optionally within {@code timeRange}.
   * A date-only end bound is midnight at the start of that day, so sales later on the end date are not counted.
   */
  public QueryResult<ProductCombination> getProductCombinations(int minOccurrences, TimeRange timeRange) {
    QueryResult<ProductCombination> result = engine.productCombinations(minOccurrences, timeRange);
    log.info("mesabi.service op=product_combinations minOccurrences={} rows={} durationMs={}",
        minOccurrences, result.metadata().totalRows(), result.metadata().executionTimeMs());
    return result;
  }
}
