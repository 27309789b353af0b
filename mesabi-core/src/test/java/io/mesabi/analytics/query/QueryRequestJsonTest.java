package io.mesabi.analytics.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryRequestJsonTest {
  private final ObjectMapper om = new ObjectMapper();

  @Test
  void parsesFullRequest() throws Exception {
    String json = """
        {
          "subject": "products",
          "measures": [{"name": "revenue", "aggregation": "sum", "field": "total_price"}],
          "dimensions": [{"name": "Product", "field": "product_id"},
                         {"field": "created_at", "grouping": "month"}],
          "filters": [{"field": "store_id", "op": "in", "value": [1, 2]},
                      {"field": "sale_status_desc", "op": "=", "value": "COMPLETED"}],
          "timeRange": {"from": "2025-01-01", "to": "2025-01-31"},
          "orderBy": {"field": "revenue", "direction": "desc"},
          "limit": 20,
          "compareTo": "previous_period"
        }
        """;

    QueryRequest q = om.readValue(json, QueryRequest.class);

    assertEquals(Subject.PRODUCTS, q.subject());
    assertEquals(List.of(Measure.of("revenue", Aggregation.SUM, "total_price")), q.measures());
    assertEquals(new Dimension("Product", "product_id", null), q.dimensions().get(0));
    assertEquals(Dimension.bucketed("created_at", TimeGrouping.MONTH), q.dimensions().get(1));
    assertEquals(Filter.of("store_id", FilterOperator.IN, List.of(1, 2)), q.filters().get(0));
    assertEquals(Filter.eq("sale_status_desc", "COMPLETED"), q.filters().get(1));
    assertEquals(new TimeRange("2025-01-01", "2025-01-31"), q.timeRange());
    assertEquals(new OrderBy("revenue", OrderBy.Direction.DESC), q.orderBy());
    assertEquals(20, q.limit());
    assertEquals("previous_period", q.compareTo());
  }

  @Test
  void listsAreReadOnlyViews() {
    QueryRequest q = QueryRequest.of(Subject.SALES).withDimension(Dimension.of("store_id"));
    assertThrows(UnsupportedOperationException.class, () -> q.dimensions().add(Dimension.of("channel_id")));
    assertThrows(UnsupportedOperationException.class, () -> q.filters().add(Filter.eq("store_id", 1)));
    assertThrows(UnsupportedOperationException.class, () -> q.measures().clear());
    q.withDimension(Dimension.of("channel_id"));
    assertEquals(2, q.dimensions().size());
  }

  @Test
  void acceptsLegacySubjectNames() throws Exception {
    assertEquals(Subject.SALES, om.readValue("{\"subject\":\"vendas\"}", QueryRequest.class).subject());
    assertEquals(Subject.DELIVERIES, om.readValue("{\"subject\":\"Entregas\"}", QueryRequest.class).subject());
    assertEquals(Subject.CUSTOMERS, om.readValue("{\"subject\":\"clientes\"}", QueryRequest.class).subject());
  }

  @Test
  void acceptsStartEndTimeRange() throws Exception {
    QueryRequest q = om.readValue(
        "{\"subject\":\"sales\",\"timeRange\":{\"start\":\"2025-01-01\",\"end\":\"2025-01-31\"}}", QueryRequest.class);
    assertEquals(new TimeRange("2025-01-01", "2025-01-31"), q.timeRange());
  }

  @Test
  void rejectsUnknownSubject() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> om.readValue("{\"subject\":\"invoices\"}", QueryRequest.class));
    assertEquals("Unknown subject: invoices", ex.getMessage());
  }

  @Test
  void rejectsUnsupportedOperator() {
    String json = "{\"subject\":\"sales\",\"filters\":[{\"field\":\"store_id\",\"op\":\"~=\",\"value\":1}]}";
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> om.readValue(json, QueryRequest.class));
    assertEquals("Unsupported operator: ~=", ex.getMessage());
  }

  @Test
  void rejectsNonIntegerLimit() {
    assertThrows(QueryValidationException.class,
        () -> om.readValue("{\"subject\":\"sales\",\"limit\":2.5}", QueryRequest.class));
    assertThrows(QueryValidationException.class,
        () -> om.readValue("{\"subject\":\"sales\",\"limit\":\"ten\"}", QueryRequest.class));
  }

  @Test
  void rejectsUnknownGroupingAndAggregation() {
    assertThrows(QueryValidationException.class, () -> om.readValue(
        "{\"subject\":\"sales\",\"dimensions\":[{\"field\":\"created_at\",\"grouping\":\"fortnight\"}]}",
        QueryRequest.class));
    assertThrows(QueryValidationException.class, () -> om.readValue(
        "{\"subject\":\"sales\",\"measures\":[{\"name\":\"m\",\"aggregation\":\"median\",\"field\":\"total_amount\"}]}",
        QueryRequest.class));
  }

  @Test
  void keepsFilterValueTypes() throws Exception {
    String json = """
        {"subject": "sales", "filters": [
          {"field": "a", "op": "=", "value": 3},
          {"field": "b", "op": "=", "value": 12345678901},
          {"field": "c", "op": "=", "value": 1.5},
          {"field": "d", "op": "=", "value": true},
          {"field": "e", "op": "=", "value": null}
        ]}
        """;
    List<Filter> f = om.readValue(json, QueryRequest.class).filters();
    assertEquals(3, f.get(0).value());
    assertEquals(12345678901L, f.get(1).value());
    assertEquals(1.5, f.get(2).value());
    assertEquals(Boolean.TRUE, f.get(3).value());
    assertNull(f.get(4).value());
  }
}
