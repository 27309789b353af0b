package io.mesabi.analytics.catalog;

import io.mesabi.analytics.query.FilterOperator;

import java.util.Objects;

/**
 * Filter-only pseudo field computed from the temporal column, e.g. {@code hour_from}.
 *
 * @param fixedOperator operator implied by the field name ({@code hour_from} is always {@code >=});
 *                      null when the request's own operator applies
 */
public record DerivedFilter(String name, DatePart part, FilterOperator fixedOperator) {
  public DerivedFilter {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(part, "part");
  }
}
