package io.mesabi.analytics.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.mesabi.analytics.catalog.RestaurantCatalog;
import io.mesabi.analytics.jdbc.dialect.AnalyticsQueryCompiler;
import io.mesabi.analytics.jdbc.postgres.PostgresDialect;
import io.mesabi.analytics.query.TimeRange;
import io.mesabi.analytics.result.ProductCombination;
import io.mesabi.analytics.result.QueryResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/** Runs the combination query against an in-memory H2 database in PostgreSQL mode. */
final class ProductCombinationDataTest {
  private HikariDataSource ds;
  private AnalyticsEngine engine;
  private int saleId;
  private int lineId;

  @BeforeEach
  void setUp() throws SQLException {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl("jdbc:h2:mem:combos_" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    hc.setMaximumPoolSize(2);
    ds = new HikariDataSource(hc);

    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("CREATE TABLE sales (id INTEGER PRIMARY KEY, created_at TIMESTAMP NOT NULL, "
          + "total_amount DECIMAL(10, 2) NOT NULL)");
      st.execute("CREATE TABLE product_sales (id INTEGER PRIMARY KEY, sale_id INTEGER NOT NULL, "
          + "product_id INTEGER NOT NULL)");
    }

    PostgresDialect dialect = new PostgresDialect();
    JdbcQueryExecutor executor = new JdbcQueryExecutor(ds, dialect.binder(), Duration.ofSeconds(5));
    engine = new AnalyticsEngine(new AnalyticsQueryCompiler(RestaurantCatalog.defaults(), dialect), executor);

    // pair 10/20: five sales inside January, four outside
    for (int amount : new int[] {30, 40, 50, 60, 70}) sale(jan(5 + amount / 10), amount, 10, 20);
    sale(LocalDateTime.of(2024, 12, 20, 12, 0), 50, 10, 20);
    sale(LocalDateTime.of(2025, 2, 10, 12, 0), 50, 20, 10);
    sale(LocalDateTime.of(2025, 2, 11, 12, 0), 50, 10, 20);
    // a date-only end bound is midnight, so the evening of the 31st is outside the window
    sale(LocalDateTime.of(2025, 1, 31, 18, 0), 50, 10, 20);

    // pair 30/40: four inside, two outside
    for (int day = 1; day <= 4; day++) sale(jan(day), 25, 40, 30);
    sale(LocalDateTime.of(2025, 3, 1, 12, 0), 25, 30, 40);
    sale(LocalDateTime.of(2025, 3, 2, 12, 0), 25, 30, 40);

    // single-product sales and repeated lines of one product never form a pair
    for (int day = 1; day <= 6; day++) sale(jan(day), 12, 50);
    for (int day = 1; day <= 6; day++) sale(jan(day), 18, 60, 60);
  }

  @AfterEach
  void tearDown() throws SQLException {
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("SHUTDOWN");
    } finally {
      ds.close();
    }
  }

  @Test
  void returnsOnlyThePairAtTheThresholdInsideTheWindow() {
    QueryResult<ProductCombination> r = engine.productCombinations(5, new TimeRange("2025-01-01", "2025-01-31"));

    assertEquals(List.of(new ProductCombination(10, 20, 5, 250.0, 50.0)), r.data());
    assertEquals(1, r.metadata().totalRows());
    assertFalse(r.metadata().cached());
  }

  @Test
  void withoutWindowEveryPairIsOrderedAndReportedOnce() {
    List<ProductCombination> pairs = engine.productCombinations(1, null).data();

    assertEquals(2, pairs.size());
    Set<List<Long>> seen = new HashSet<>();
    for (ProductCombination p : pairs) {
      assertTrue(p.productIdA() < p.productIdB(), p.toString());
      assertTrue(seen.add(List.of(p.productIdA(), p.productIdB())), p.toString());
    }
    assertEquals(new ProductCombination(10, 20, 9, 450.0, 50.0), pairs.get(0));
    assertEquals(new ProductCombination(30, 40, 6, 150.0, 25.0), pairs.get(1));
  }

  @Test
  void widerWindowCountsMoreSales() {
    List<ProductCombination> pairs = engine.productCombinations(5, new TimeRange("2025-01-01", "2025-03-31")).data();

    assertEquals(2, pairs.size());
    assertEquals(8, pairs.get(0).timesTogether());
    assertEquals(6, pairs.get(1).timesTogether());
    assertEquals(30, pairs.get(1).productIdA());
  }

  @Test
  void thresholdAboveEveryCountReturnsNothing() {
    assertTrue(engine.productCombinations(10, null).data().isEmpty());
  }

  private static LocalDateTime jan(int day) {
    return LocalDateTime.of(2025, 1, day, 12, 0);
  }

  private void sale(LocalDateTime at, int amount, int... products) throws SQLException {
    int id = ++saleId;
    try (Connection c = ds.getConnection()) {
      try (PreparedStatement ps = c.prepareStatement("INSERT INTO sales (id, created_at, total_amount) VALUES (?, ?, ?)")) {
        ps.setInt(1, id);
        ps.setTimestamp(2, Timestamp.valueOf(at));
        ps.setBigDecimal(3, BigDecimal.valueOf(amount));
        ps.executeUpdate();
      }
      try (PreparedStatement ps = c.prepareStatement("INSERT INTO product_sales (id, sale_id, product_id) VALUES (?, ?, ?)")) {
        for (int product : products) {
          ps.setInt(1, ++lineId);
          ps.setInt(2, id);
          ps.setInt(3, product);
          ps.executeUpdate();
        }
      }
    }
  }
}
