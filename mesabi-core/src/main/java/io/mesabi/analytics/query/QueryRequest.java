package io.mesabi.analytics.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.*;

/**
 * Declarative analytics request: a subject plus measures, dimensions, filters, time range, ordering and limit.
 * <p>
 * Built with the {@code with*} methods or parsed from the wire JSON by {@link QueryRequestJsonDeserializer}.
 */
@JsonDeserialize(using = QueryRequestJsonDeserializer.class)
public final class QueryRequest {
  private final Subject subject;
  private List<Measure> measures = new ArrayList<>();
  private List<Dimension> dimensions = new ArrayList<>();
  private List<Filter> filters = new ArrayList<>();
  private TimeRange timeRange;
  private OrderBy orderBy;
  private Integer limit;
  private String compareTo;

  public QueryRequest(Subject subject) {
    this.subject = Objects.requireNonNull(subject, "subject");
  }

  public static QueryRequest of(Subject subject) {
    return new QueryRequest(subject);
  }

  public Subject subject() { return subject; }
  public List<Measure> measures() { return Collections.unmodifiableList(measures); }
  public List<Dimension> dimensions() { return Collections.unmodifiableList(dimensions); }
  public List<Filter> filters() { return Collections.unmodifiableList(filters); }
  public TimeRange timeRange() { return timeRange; }
  public OrderBy orderBy() { return orderBy; }
  public Integer limit() { return limit; }
  /** Period label older dashboards send along; not used when compiling. */
  public String compareTo() { return compareTo; }

  public QueryRequest withMeasures(List<Measure> measures) { this.measures = new ArrayList<>(measures == null ? List.of() : measures); return this; }
  public QueryRequest withMeasure(Measure measure) { this.measures.add(Objects.requireNonNull(measure, "measure")); return this; }
  public QueryRequest withDimensions(List<Dimension> dimensions) { this.dimensions = new ArrayList<>(dimensions == null ? List.of() : dimensions); return this; }
  public QueryRequest withDimension(Dimension dimension) { this.dimensions.add(Objects.requireNonNull(dimension, "dimension")); return this; }
  public QueryRequest withFilters(List<Filter> filters) { this.filters = new ArrayList<>(filters == null ? List.of() : filters); return this; }
  public QueryRequest withFilter(Filter filter) { this.filters.add(Objects.requireNonNull(filter, "filter")); return this; }
  public QueryRequest withTimeRange(TimeRange timeRange) { this.timeRange = timeRange; return this; }
  public QueryRequest withOrderBy(OrderBy orderBy) { this.orderBy = orderBy; return this; }
  public QueryRequest withLimit(Integer limit) { this.limit = limit; return this; }
  public QueryRequest withCompareTo(String compareTo) { this.compareTo = compareTo; return this; }
}
