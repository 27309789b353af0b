package io.mesabi.analytics.catalog;

import java.util.Objects;

/**
 * A LEFT JOIN reachable from a subject's base table.
 *
 * @param dependsOn alias this join's ON condition reads from (pulled in first); null when it joins the base table
 * @param always    joined for every request on the subject
 */
public record JoinDef(String alias, String table, String on, String dependsOn, boolean always) {
  public JoinDef {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(on, "on");
  }

  public String sql() {
    return "LEFT JOIN " + table + " " + alias + " ON " + on;
  }
}
