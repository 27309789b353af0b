package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.DisplayColumn;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** GROUP BY from the same dimension expressions the SELECT emitted, plus display-name group expressions. */
final class GroupByRenderer {
  private GroupByRenderer() {}

  static String render(List<DimensionExpressions.Column> dimensions, List<DisplayColumn> displays) {
    if (dimensions.isEmpty()) return "";
    Set<String> exprs = new LinkedHashSet<>();
    for (DimensionExpressions.Column c : dimensions) exprs.add(c.expression());
    for (DisplayColumn dc : displays) exprs.addAll(dc.groupExpressions());
    return "GROUP BY " + String.join(", ", exprs);
  }
}
