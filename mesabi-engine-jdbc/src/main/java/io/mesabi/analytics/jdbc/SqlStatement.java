package io.mesabi.analytics.jdbc;

import io.mesabi.analytics.compile.Bind;

import java.util.List;

/**
 * Compiled SQL with named placeholders ({@code :b1}, {@code :b2}, ...) and their binds in appearance order.
 *
 * @param joinAliases aliases of the LEFT JOINs the compiler added, in emission order
 */
public record SqlStatement(String sql, List<Bind> binds, List<String> joinAliases) {
  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    joinAliases = joinAliases == null ? List.of() : List.copyOf(joinAliases);
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, List.of());
  }
}
