package io.mesabi.analytics.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Human-readable label emitted next to an id dimension, e.g. {@code p.name AS product_name} when grouping by
 * {@code product_id}.
 *
 * @param groupExpressions expressions the GROUP BY needs for this label (at least {@code expression})
 */
public record DisplayColumn(String triggerField, String expression, String alias,
                            List<String> groupExpressions, String joinAlias) {
  public DisplayColumn {
    Objects.requireNonNull(triggerField, "triggerField");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(alias, "alias");
    groupExpressions = (groupExpressions == null || groupExpressions.isEmpty())
        ? List.of(expression)
        : List.copyOf(groupExpressions);
  }
}
