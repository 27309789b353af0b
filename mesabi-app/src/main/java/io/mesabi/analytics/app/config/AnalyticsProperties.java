package io.mesabi.analytics.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mesabi")
public class AnalyticsProperties {
  private final Datasource datasource = new Datasource();
  private final Query query = new Query();

  public Datasource getDatasource() { return datasource; }
  public Query getQuery() { return query; }

  public static class Datasource {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Query {
    /** Statement timeout enforced by the driver; 0 disables it. */
    private long timeoutMillis = 30_000;
    /** Upper bound accepted for a request's {@code limit}. */
    private int maxLimit = 10_000;

    public long getTimeoutMillis() { return timeoutMillis; }
    public void setTimeoutMillis(long timeoutMillis) { this.timeoutMillis = timeoutMillis; }
    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
  }
}
