package io.mesabi.analytics.catalog;

import java.util.Objects;

/**
 * A DSL field as the store sees it.
 *
 * @param name       DSL field name, e.g. {@code created_at}
 * @param expression qualified SQL expression, e.g. {@code s.created_at}
 * @param type       column type
 * @param joinAlias  alias of the join that must be present for {@code expression} to resolve; null for base-table columns
 */
public record FieldDef(String name, String expression, ColumnType type, String joinAlias) {
  public FieldDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(type, "type");
    joinAlias = (joinAlias == null || joinAlias.isBlank()) ? null : joinAlias;
  }
}
