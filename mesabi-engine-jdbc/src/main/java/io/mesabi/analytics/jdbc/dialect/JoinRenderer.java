package io.mesabi.analytics.jdbc.dialect;

import io.mesabi.analytics.catalog.JoinDef;

import java.util.ArrayList;
import java.util.List;

final class JoinRenderer {
  private JoinRenderer() {}

  static List<String> render(List<JoinDef> joins) {
    List<String> out = new ArrayList<>(joins.size());
    for (JoinDef j : joins) out.add(j.sql());
    return out;
  }
}
