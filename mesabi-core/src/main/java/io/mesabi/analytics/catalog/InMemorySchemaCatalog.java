package io.mesabi.analytics.catalog;

import io.mesabi.analytics.query.QueryValidationException;
import io.mesabi.analytics.query.Subject;

import java.util.*;

public final class InMemorySchemaCatalog implements SchemaCatalog {
  private final Map<Subject, SubjectSchema> schemas;

  public InMemorySchemaCatalog(Collection<SubjectSchema> schemas) {
    Map<Subject, SubjectSchema> m = new EnumMap<>(Subject.class);
    for (SubjectSchema s : Objects.requireNonNull(schemas, "schemas")) {
      if (m.putIfAbsent(s.subject(), s) != null) {
        throw new IllegalArgumentException("Duplicate schema for subject: " + s.subject());
      }
    }
    this.schemas = Collections.unmodifiableMap(m);
  }

  @Override
  public SubjectSchema schema(Subject subject) {
    SubjectSchema s = (subject == null) ? null : schemas.get(subject);
    if (s == null) throw new QueryValidationException("No schema registered for subject: " + subject);
    return s;
  }
}
