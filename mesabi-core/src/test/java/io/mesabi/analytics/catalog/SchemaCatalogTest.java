package io.mesabi.analytics.catalog;

import io.mesabi.analytics.query.Aggregation;
import io.mesabi.analytics.query.Dimension;
import io.mesabi.analytics.query.Filter;
import io.mesabi.analytics.query.Measure;
import io.mesabi.analytics.query.OrderBy;
import io.mesabi.analytics.query.QueryRequest;
import io.mesabi.analytics.query.QueryValidationException;
import io.mesabi.analytics.query.Subject;
import io.mesabi.analytics.query.TimeRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaCatalogTest {
  private final SchemaCatalog catalog = RestaurantCatalog.defaults();

  @Test
  void mapsSubjectsToBaseTables() {
    assertEquals("sales", catalog.baseTable(Subject.SALES));
    assertEquals("delivery_sales", catalog.baseTable(Subject.DELIVERIES));
    assertEquals("product_sales", catalog.baseTable(Subject.PRODUCTS));
    assertEquals("customers", catalog.baseTable(Subject.CUSTOMERS));
    assertEquals("item_product_sales", catalog.baseTable(Subject.ITEMS));
  }

  @Test
  void qualifiesAmbiguousColumnsPerSubject() {
    assertEquals("sales.created_at", catalog.qualify(Subject.SALES, "created_at").expression());
    assertEquals("s.created_at", catalog.qualify(Subject.PRODUCTS, "created_at").expression());
    assertEquals("s.created_at", catalog.qualify(Subject.ITEMS, "created_at").expression());
    assertEquals("s.created_at", catalog.qualify(Subject.DELIVERIES, "created_at").expression());
    assertEquals("da.city", catalog.qualify(Subject.SALES, "city").expression());
    assertEquals("sales.store_id", catalog.qualify(Subject.SALES, "store_id").expression());
    assertEquals("ps.product_id", catalog.qualify(Subject.ITEMS, "product_id").expression());
    assertEquals(ColumnType.DECIMAL, catalog.qualify(Subject.SALES, "total_amount").type());
  }

  @Test
  void rejectsUnknownField() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> catalog.qualify(Subject.SALES, "price; DROP TABLE sales"));
    assertEquals("Unknown field 'price; DROP TABLE sales' for subject 'sales'", ex.getMessage());
  }

  @Test
  void rejectsUnregisteredSubject() {
    SchemaCatalog onlySales = new InMemorySchemaCatalog(List.of(RestaurantCatalog.sales()));
    assertThrows(QueryValidationException.class, () -> onlySales.baseTable(Subject.PRODUCTS));
  }

  @Test
  void joinsOnlyWhatIsReferenced() {
    assertTrue(catalog.requiredJoins(QueryRequest.of(Subject.SALES)).isEmpty());
    assertEquals(List.of("ch"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.SALES)
        .withDimension(Dimension.of("channel_id")))));
    assertEquals(List.of("da"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.SALES)
        .withFilter(Filter.eq("city", "Curitiba")))));
  }

  @Test
  void emitsJoinsInDeclarationOrderWithoutDuplicates() {
    QueryRequest q = QueryRequest.of(Subject.SALES)
        .withDimensions(List.of(Dimension.of("customer_id"), Dimension.of("city"), Dimension.of("store_id")))
        .withFilters(List.of(Filter.eq("state", "PR"), Filter.eq("store_id", 1)));
    assertEquals(List.of("st", "da", "c"), aliases(catalog.requiredJoins(q)));
  }

  @Test
  void measuresTimeRangeAndOrderByPullTheirJoins() {
    assertEquals(List.of("s"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.PRODUCTS)
        .withMeasure(Measure.of("revenue", Aggregation.SUM, "total_amount")))));
    assertEquals(List.of("s"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.PRODUCTS)
        .withTimeRange(new TimeRange("2025-01-01", "2025-01-31")))));
    assertEquals(List.of("da"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.SALES)
        .withOrderBy(new OrderBy("city", OrderBy.Direction.ASC)))));
  }

  @Test
  void orderByMeasureAliasAddsNoJoin() {
    QueryRequest q = QueryRequest.of(Subject.SALES)
        .withMeasure(Measure.of("city", Aggregation.SUM, "total_amount"))
        .withOrderBy(new OrderBy("city", OrderBy.Direction.DESC));
    assertTrue(catalog.requiredJoins(q).isEmpty());
  }

  @Test
  void derivedFieldsPullTheTemporalJoin() {
    assertEquals(List.of("s"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.PRODUCTS)
        .withDimension(Dimension.of("day_of_week")))));
    assertEquals(List.of("s"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.DELIVERIES)
        .withFilter(Filter.eq("hour_from", 18)))));
    assertTrue(catalog.requiredJoins(QueryRequest.of(Subject.SALES)
        .withDimension(Dimension.of("hour_of_day"))).isEmpty());
  }

  @Test
  void alwaysJoinsAndDependenciesArePulledIn() {
    assertEquals(List.of("ps", "s"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.ITEMS))));
    assertEquals(List.of("ps", "s", "p"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.ITEMS)
        .withDimension(Dimension.of("product_id")))));
    assertEquals(List.of("ps", "s", "i"), aliases(catalog.requiredJoins(QueryRequest.of(Subject.ITEMS)
        .withDimension(Dimension.of("item_id")))));
  }

  @Test
  void displayColumnsFollowDimensionPresence() {
    SubjectSchema sales = catalog.schema(Subject.SALES);
    List<DisplayColumn> dcs = sales.displayColumnsFor(List.of("channel_id", "store_id"));
    assertEquals(2, dcs.size());
    assertEquals("store_name", dcs.get(0).alias());
    assertEquals(List.of("st.name"), dcs.get(0).groupExpressions());
    assertEquals("channel_name", dcs.get(1).alias());
    assertEquals(List.of("ch.description", "ch.id"), dcs.get(1).groupExpressions());
    assertTrue(sales.displayColumnsFor(List.of("city")).isEmpty());
  }

  @Test
  void dayOfWeekMapsSundayToStoreNumbering() {
    assertEquals(0, DatePart.DAY_OF_WEEK.toStoreValue(7));
    assertEquals(1, DatePart.DAY_OF_WEEK.toStoreValue(1));
    assertEquals(6, DatePart.DAY_OF_WEEK.toStoreValue(6));
    assertEquals(23, DatePart.HOUR.toStoreValue(23));
  }

  @Test
  void builderRejectsDanglingJoinAlias() {
    SubjectSchema.Builder b = SubjectSchema.builder(Subject.SALES, "sales")
        .joinedColumns("zz", ColumnType.TEXT, "name");
    assertThrows(IllegalStateException.class, b::build);
  }

  private static List<String> aliases(List<JoinDef> joins) {
    List<String> out = new ArrayList<>();
    for (JoinDef j : joins) out.add(j.alias());
    return out;
  }
}
