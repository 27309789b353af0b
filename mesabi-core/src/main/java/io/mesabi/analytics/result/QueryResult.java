package io.mesabi.analytics.result;

import java.util.List;
import java.util.Objects;

public record QueryResult<T>(List<T> data, QueryMetadata metadata) {
  public QueryResult {
    data = (data == null) ? List.of() : List.copyOf(data);
    Objects.requireNonNull(metadata, "metadata");
  }
}
