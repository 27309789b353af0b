package io.mesabi.analytics.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class MesabiAnalyticsApplication {
  public static void main(String[] args) {
    SpringApplication.run(MesabiAnalyticsApplication.class, args);
  }
}
