package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.compile.Bind;

import java.util.ArrayList;
import java.util.List;

/** Collects binds while clauses render; hands out {@code :bN} placeholders in order. */
public final class RenderCtx {
  private int n = 1;
  private final List<Bind> binds = new ArrayList<>();

  public String add(Bind b) {
    binds.add(b);
    return ":b" + (n++);
  }

  public List<Bind> binds() { return List.copyOf(binds); }
}
