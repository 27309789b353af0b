package io.mesabi.analytics.query;

import java.util.Locale;

public enum Subject {
  SALES("sales", "vendas"),
  DELIVERIES("deliveries", "entregas"),
  PRODUCTS("products", "produtos"),
  CUSTOMERS("customers", "clientes"),
  ITEMS("items", "items");

  private final String wireName;
  private final String legacyName;

  Subject(String wireName, String legacyName) {
    this.wireName = wireName;
    this.legacyName = legacyName;
  }

  public String wireName() { return wireName; }

  /** Accepts the English wire name and the Portuguese name older dashboards still send. */
  public static Subject fromWire(String raw) {
    if (raw == null || raw.isBlank()) throw new QueryValidationException("Missing subject");
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (Subject subject : values()) {
      if (subject.wireName.equals(s) || subject.legacyName.equals(s)) return subject;
    }
    throw new QueryValidationException("Unknown subject: " + raw);
  }
}
