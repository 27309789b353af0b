package io.mesabi.analytics.compile;

import io.mesabi.analytics.catalog.ColumnType;

/** A value bound to a statement placeholder, already coerced to {@code type}. */
public record Bind(Object value, ColumnType type) {
}
