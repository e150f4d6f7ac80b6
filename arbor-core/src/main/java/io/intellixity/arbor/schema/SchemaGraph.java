package io.intellixity.arbor.schema;

import io.intellixity.arbor.error.SchemaException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of tables and their relations.
 * <p>
 * Construction checks structure only: relation targets and junction tables exist, declared columns exist on the
 * tables they belong to and paired column lists have equal length. Omitted mappings are inferred later by the
 * relation resolver.
 */
public final class SchemaGraph {
  private final Map<String, TableDef> tables;

  public SchemaGraph(Collection<TableDef> tables) {
    LinkedHashMap<String, TableDef> m = new LinkedHashMap<>();
    for (TableDef t : tables) {
      if (m.put(t.name(), t) != null) throw new SchemaException("Duplicate table '" + t.name() + "'");
    }
    this.tables = Collections.unmodifiableMap(m);
    for (TableDef t : m.values()) {
      for (RelationDef r : t.relations().values()) validate(t, r);
    }
  }

  public static SchemaGraph of(TableDef... tables) {
    return new SchemaGraph(List.of(tables));
  }

  public Collection<TableDef> tables() { return tables.values(); }

  public boolean hasTable(String name) { return tables.containsKey(name); }

  public TableDef table(String name) {
    TableDef t = tables.get(name);
    if (t == null) throw new SchemaException("Unknown table '" + name + "'");
    return t;
  }

  private void validate(TableDef source, RelationDef r) {
    String where = "relation '" + source.name() + "." + r.name() + "'";
    TableDef target = tables.get(r.target());
    if (target == null) throw new SchemaException("Unknown target table '" + r.target() + "' for " + where);

    if (r.through() == null && r.fromColumns().size() != r.toColumns().size()) {
      throw new SchemaException("Mismatched from/to column counts for " + where);
    }
    for (String c : r.fromColumns()) requireColumn(source, c, where);
    for (String c : r.toColumns()) requireColumn(target, c, where);

    ThroughDef through = r.through();
    if (through == null) return;
    TableDef junction = tables.get(through.table());
    if (junction == null) throw new SchemaException("Unknown junction table '" + through.table() + "' for " + where);
    if (through.hasDeclaredColumns()) {
      if (through.sourceColumns().size() != r.fromColumns().size() || through.targetColumns().size() != r.toColumns().size()) {
        throw new SchemaException("Junction columns do not pair with from/to columns for " + where);
      }
    }
    for (String c : through.sourceColumns()) requireColumn(junction, c, where);
    for (String c : through.targetColumns()) requireColumn(junction, c, where);
    if (through.sourceRelation() != null) junctionRelation(junction, through.sourceRelation(), where);
    if (through.targetRelation() != null) junctionRelation(junction, through.targetRelation(), where);
  }

  private static void junctionRelation(TableDef junction, String name, String where) {
    if (!junction.hasRelation(name)) {
      throw new SchemaException("Unknown junction relation '" + junction.name() + "." + name + "' for " + where);
    }
  }

  private static void requireColumn(TableDef t, String column, String where) {
    if (!t.hasColumn(column)) {
      throw new SchemaException("Unknown column '" + t.name() + "." + column + "' in " + where);
    }
  }
}
