package io.mesabi.analytics.catalog;

import io.mesabi.analytics.query.Dimension;
import io.mesabi.analytics.query.Filter;
import io.mesabi.analytics.query.FilterOperator;
import io.mesabi.analytics.query.Measure;
import io.mesabi.analytics.query.QueryRequest;
import io.mesabi.analytics.query.QueryValidationException;
import io.mesabi.analytics.query.Subject;

import java.util.*;

/**
 * Everything the compiler knows about one subject: its base table, the closed set of fields with their qualified
 * expressions, reachable joins, display-name columns and derived temporal fields.
 * <p>
 * Immutable; build with {@link #builder(Subject, String)}.
 */
public final class SubjectSchema {
  private final Subject subject;
  private final String baseTable;
  private final String temporalField;
  private final Map<String, FieldDef> fields;
  private final Map<String, DatePart> derivedDimensions;
  private final Map<String, DerivedFilter> derivedFilters;
  private final List<JoinDef> joins;
  private final List<DisplayColumn> displayColumns;

  private SubjectSchema(Builder b) {
    this.subject = b.subject;
    this.baseTable = b.baseTable;
    this.temporalField = b.temporalField;
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
    this.derivedDimensions = Collections.unmodifiableMap(new LinkedHashMap<>(b.derivedDimensions));
    this.derivedFilters = Collections.unmodifiableMap(new LinkedHashMap<>(b.derivedFilters));
    this.joins = List.copyOf(b.joins.values());
    this.displayColumns = List.copyOf(b.displayColumns);
  }

  public Subject subject() { return subject; }
  public String baseTable() { return baseTable; }
  public Map<String, FieldDef> fields() { return fields; }
  public List<JoinDef> joins() { return joins; }
  public List<DisplayColumn> displayColumns() { return displayColumns; }

  /** The one place a DSL field becomes a SQL expression. Unknown fields are rejected. */
  public FieldDef qualify(String field) {
    FieldDef f = (field == null) ? null : fields.get(field);
    if (f == null) {
      throw new QueryValidationException("Unknown field '" + field + "' for subject '" + subject.wireName() + "'");
    }
    return f;
  }

  /** Canonical temporal column (time range, derived dimensions and filters read from it). */
  public FieldDef temporal() {
    if (temporalField == null) {
      throw new QueryValidationException("Subject '" + subject.wireName() + "' has no temporal column");
    }
    return qualify(temporalField);
  }

  /** Derived dimension part for {@code field}, or null when the field is not derived. */
  public DatePart derivedDimension(String field) { return derivedDimensions.get(field); }

  /** Filter-only pseudo field, or null. */
  public DerivedFilter derivedFilter(String field) { return derivedFilters.get(field); }

  /** Display columns triggered by the given dimension fields, in catalog order. */
  public List<DisplayColumn> displayColumnsFor(Collection<String> dimensionFields) {
    List<DisplayColumn> out = new ArrayList<>();
    for (DisplayColumn dc : displayColumns) {
      if (dimensionFields.contains(dc.triggerField())) out.add(dc);
    }
    return out;
  }

  /**
   * Joins needed by every field the request touches: measures, dimensions, filters, the time range, a catalog
   * field in ORDER BY, plus the display columns of the dimensions.
   * Result is deduplicated, dependency-closed and in declaration order.
   */
  public List<JoinDef> requiredJoins(QueryRequest q) {
    List<String> dimensionFields = new ArrayList<>();
    for (Dimension d : q.dimensions()) dimensionFields.add(d.field());

    List<String> referenced = new ArrayList<>(dimensionFields);
    Set<String> measureAliases = new HashSet<>();
    for (Measure m : q.measures()) {
      measureAliases.add(m.name());
      if (!Measure.ALL_ROWS.equals(m.field())) referenced.add(m.field());
    }
    for (Filter f : q.filters()) referenced.add(f.field());
    if (q.timeRange() != null) referenced.add(temporal().name());
    if (q.orderBy() != null && !measureAliases.contains(q.orderBy().field())) referenced.add(q.orderBy().field());
    return requiredJoins(referenced, dimensionFields);
  }

  private List<JoinDef> requiredJoins(Collection<String> referencedFields, Collection<String> dimensionFields) {
    Set<String> needed = new HashSet<>();
    for (JoinDef j : joins) {
      if (j.always()) needed.add(j.alias());
    }
    for (String f : referencedFields) {
      String alias = joinAliasOf(f);
      if (alias != null) needed.add(alias);
    }
    for (DisplayColumn dc : displayColumnsFor(dimensionFields)) {
      if (dc.joinAlias() != null) needed.add(dc.joinAlias());
    }

    boolean grew = true;
    while (grew) {
      grew = false;
      for (JoinDef j : joins) {
        if (needed.contains(j.alias()) && j.dependsOn() != null && needed.add(j.dependsOn())) grew = true;
      }
    }

    List<JoinDef> out = new ArrayList<>();
    for (JoinDef j : joins) {
      if (needed.contains(j.alias())) out.add(j);
    }
    return out;
  }

  private String joinAliasOf(String field) {
    if (field == null) return null;
    if (derivedDimensions.containsKey(field) || derivedFilters.containsKey(field)) {
      return temporal().joinAlias();
    }
    FieldDef f = fields.get(field);
    return f == null ? null : f.joinAlias();
  }

  public static Builder builder(Subject subject, String baseTable) {
    return new Builder(subject, baseTable);
  }

  public static final class Builder {
    private final Subject subject;
    private final String baseTable;
    private String temporalField;
    private final Map<String, FieldDef> fields = new LinkedHashMap<>();
    private final Map<String, DatePart> derivedDimensions = new LinkedHashMap<>();
    private final Map<String, DerivedFilter> derivedFilters = new LinkedHashMap<>();
    private final Map<String, JoinDef> joins = new LinkedHashMap<>();
    private final List<DisplayColumn> displayColumns = new ArrayList<>();

    private Builder(Subject subject, String baseTable) {
      this.subject = Objects.requireNonNull(subject, "subject");
      this.baseTable = Objects.requireNonNull(baseTable, "baseTable");
    }

    public Builder temporal(String field) { this.temporalField = field; return this; }

    /** Base-table columns, qualified with the table name. */
    public Builder columns(ColumnType type, String... names) {
      for (String n : names) field(new FieldDef(n, baseTable + "." + n, type, null));
      return this;
    }

    /** Columns that live on a joined alias and keep their column name. */
    public Builder joinedColumns(String alias, ColumnType type, String... names) {
      for (String n : names) field(new FieldDef(n, alias + "." + n, type, alias));
      return this;
    }

    public Builder field(FieldDef f) {
      if (fields.putIfAbsent(f.name(), f) != null) {
        throw new IllegalArgumentException("Duplicate field '" + f.name() + "' for subject " + subject);
      }
      return this;
    }

    public Builder join(String alias, String table, String on) {
      return join(new JoinDef(alias, table, on, null, false));
    }

    public Builder join(JoinDef j) {
      if (joins.putIfAbsent(j.alias(), j) != null) {
        throw new IllegalArgumentException("Duplicate join alias '" + j.alias() + "' for subject " + subject);
      }
      return this;
    }

    public Builder display(String triggerField, String expression, String alias, String joinAlias,
                           String... groupExpressions) {
      displayColumns.add(new DisplayColumn(triggerField, expression, alias, List.of(groupExpressions), joinAlias));
      return this;
    }

    /** {@code day_of_week}/{@code hour_of_day} dimensions and {@code day_of_week}/{@code hour_from}/{@code hour_to} filters. */
    public Builder temporalDerivations() {
      derivedDimensions.put("day_of_week", DatePart.DAY_OF_WEEK);
      derivedDimensions.put("hour_of_day", DatePart.HOUR);
      derivedFilters.put("day_of_week", new DerivedFilter("day_of_week", DatePart.DAY_OF_WEEK, null));
      derivedFilters.put("hour_from", new DerivedFilter("hour_from", DatePart.HOUR, FilterOperator.GE));
      derivedFilters.put("hour_to", new DerivedFilter("hour_to", DatePart.HOUR, FilterOperator.LE));
      return this;
    }

    public SubjectSchema build() {
      if (temporalField != null && !fields.containsKey(temporalField)) {
        throw new IllegalStateException("Temporal field '" + temporalField + "' is not declared for subject " + subject);
      }
      if (temporalField == null && (!derivedDimensions.isEmpty() || !derivedFilters.isEmpty())) {
        throw new IllegalStateException("Derived temporal fields need a temporal column for subject " + subject);
      }
      for (FieldDef f : fields.values()) requireJoin(f.joinAlias(), "field " + f.name());
      for (DisplayColumn dc : displayColumns) requireJoin(dc.joinAlias(), "display column " + dc.alias());
      for (JoinDef j : joins.values()) requireJoin(j.dependsOn(), "join " + j.alias());
      return new SubjectSchema(this);
    }

    private void requireJoin(String alias, String owner) {
      if (alias != null && !joins.containsKey(alias)) {
        throw new IllegalStateException("Unknown join alias '" + alias + "' referenced by " + owner + " of subject " + subject);
      }
    }
  }
}
