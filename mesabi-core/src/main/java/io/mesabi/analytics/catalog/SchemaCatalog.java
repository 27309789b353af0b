package io.mesabi.analytics.catalog;

import io.mesabi.analytics.query.QueryRequest;
import io.mesabi.analytics.query.Subject;

import java.util.List;

/** Static knowledge of the relational schema, keyed by subject. Pure lookup, no I/O. */
public interface SchemaCatalog {
  /** Throws {@link io.mesabi.analytics.query.QueryValidationException} when the subject is not registered. */
  SubjectSchema schema(Subject subject);

  default String baseTable(Subject subject) {
    return schema(subject).baseTable();
  }

  default FieldDef qualify(Subject subject, String field) {
    return schema(subject).qualify(field);
  }

  /** LEFT JOINs the compiled statement for {@code q} carries, in emission order. */
  default List<JoinDef> requiredJoins(QueryRequest q) {
    return schema(q.subject()).requiredJoins(q);
  }
}
