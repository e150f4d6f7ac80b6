package io.intellixity.arbor.schema;

import io.intellixity.arbor.error.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Table with ordered columns, primary key (row identity) and declared relations. */
public final class TableDef {
  private final String name;
  private final String dbName;
  private final Map<String, ColumnDef> columns;
  private final List<String> primaryKey;
  private final Map<String, RelationDef> relations;

  public TableDef(String name, String dbName, List<ColumnDef> columns, List<RelationDef> relations) {
    this.name = Objects.requireNonNull(name, "name");
    this.dbName = (dbName == null || dbName.isBlank()) ? name : dbName;
    if (columns == null || columns.isEmpty()) throw new SchemaException("Table '" + name + "' has no columns");

    LinkedHashMap<String, ColumnDef> cols = new LinkedHashMap<>();
    List<String> pk = new ArrayList<>();
    for (ColumnDef c : columns) {
      if (cols.put(c.name(), c) != null) throw new SchemaException("Duplicate column '" + c.name() + "' on table '" + name + "'");
      if (c.primaryKey()) pk.add(c.name());
    }
    LinkedHashMap<String, RelationDef> rels = new LinkedHashMap<>();
    for (RelationDef r : (relations == null ? List.<RelationDef>of() : relations)) {
      if (cols.containsKey(r.name())) {
        throw new SchemaException("Relation '" + r.name() + "' on table '" + name + "' clashes with a column of the same name");
      }
      if (rels.put(r.name(), r) != null) throw new SchemaException("Duplicate relation '" + r.name() + "' on table '" + name + "'");
    }
    this.columns = Collections.unmodifiableMap(cols);
    this.primaryKey = List.copyOf(pk);
    this.relations = Collections.unmodifiableMap(rels);
  }

  public String name() { return name; }
  public String dbName() { return dbName; }
  public List<String> primaryKey() { return primaryKey; }
  public Map<String, RelationDef> relations() { return relations; }

  /** Columns in declaration order. */
  public List<ColumnDef> columns() { return List.copyOf(columns.values()); }

  public boolean hasColumn(String column) { return columns.containsKey(column); }

  public boolean hasRelation(String relation) { return relations.containsKey(relation); }

  public ColumnDef column(String column) {
    ColumnDef c = columns.get(column);
    if (c == null) throw new SchemaException("Unknown column '" + column + "' on table '" + name + "'");
    return c;
  }

  public RelationDef relation(String relation) {
    RelationDef r = relations.get(relation);
    if (r == null) throw new SchemaException("Unknown relation '" + relation + "' on table '" + name + "'");
    return r;
  }

  /**
   * Columns that identify a row: the primary key, or every column when the table declares none.
   */
  public List<String> identityColumns() {
    if (!primaryKey.isEmpty()) return primaryKey;
    return List.copyOf(columns.keySet());
  }

  /** Same table with one more relation (used by loaders that attach relations after all tables are known). */
  public TableDef withRelation(RelationDef relation) {
    List<RelationDef> rels = new ArrayList<>(relations.values());
    rels.add(relation);
    return new TableDef(name, dbName, columns(), rels);
  }

  public static Builder builder(String name) { return new Builder(name); }

  @Override
  public String toString() { return "TableDef[" + name + "]"; }

  public static final class Builder {
    private final String name;
    private String dbName;
    private final List<ColumnDef> columns = new ArrayList<>();
    private final List<RelationDef> relations = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder dbName(String dbName) {
      this.dbName = dbName;
      return this;
    }

    public Builder column(ColumnDef column) {
      columns.add(column);
      return this;
    }

    public Builder column(String name, String logicalType) {
      return column(ColumnDef.of(name, logicalType));
    }

    public Builder id(String name, String logicalType) {
      return column(ColumnDef.id(name, logicalType));
    }

    public Builder relation(RelationDef relation) {
      relations.add(relation);
      return this;
    }

    public TableDef build() {
      return new TableDef(name, dbName, columns, relations);
    }
  }
}
