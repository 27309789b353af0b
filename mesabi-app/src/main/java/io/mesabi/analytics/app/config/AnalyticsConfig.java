package io.mesabi.analytics.app.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.mesabi.analytics.catalog.RestaurantCatalog;
import io.mesabi.analytics.catalog.SchemaCatalog;
import io.mesabi.analytics.jdbc.AnalyticsEngine;
import io.mesabi.analytics.jdbc.JdbcQueryExecutor;
import io.mesabi.analytics.jdbc.QueryExecutor;
import io.mesabi.analytics.jdbc.dialect.AnalyticsQueryCompiler;
import io.mesabi.analytics.jdbc.dialect.SqlDialect;
import io.mesabi.analytics.jdbc.postgres.PostgresDialect;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource analyticsDataSource(AnalyticsProperties props) {
    AnalyticsProperties.Datasource db = props.getDatasource();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("Missing mesabi.datasource.jdbc-url (DATABASE_URL)");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("mesabi-analytics");
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    // analytics never writes
    hc.setReadOnly(true);
    return new HikariDataSource(hc);
  }

  @Bean
  public SchemaCatalog schemaCatalog() {
    return RestaurantCatalog.defaults();
  }

  @Bean
  public SqlDialect sqlDialect() {
    return new PostgresDialect();
  }

  @Bean
  public AnalyticsQueryCompiler analyticsQueryCompiler(SchemaCatalog catalog, SqlDialect dialect,
                                                       AnalyticsProperties props) {
    return new AnalyticsQueryCompiler(catalog, dialect, props.getQuery().getMaxLimit());
  }

  @Bean
  public QueryExecutor queryExecutor(DataSource ds, SqlDialect dialect, AnalyticsProperties props) {
    return new JdbcQueryExecutor(ds, dialect.binder(), Duration.ofMillis(props.getQuery().getTimeoutMillis()));
  }

  @Bean
  public AnalyticsEngine analyticsEngine(AnalyticsQueryCompiler compiler, QueryExecutor executor) {
    return new AnalyticsEngine(compiler, executor);
  }
}
