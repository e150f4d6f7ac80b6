package io.intellixity.arbor.schema.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.arbor.error.SchemaException;
import io.intellixity.arbor.query.FilterParser;
import io.intellixity.arbor.query.Predicate;
import io.intellixity.arbor.schema.ColumnDef;
import io.intellixity.arbor.schema.DefaultPolicy;
import io.intellixity.arbor.schema.RelationDef;
import io.intellixity.arbor.schema.RelationKind;
import io.intellixity.arbor.schema.SchemaGraph;
import io.intellixity.arbor.schema.TableDef;
import io.intellixity.arbor.schema.ThroughDef;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads a {@link SchemaGraph} from YAML (or JSON, which is valid YAML).
 *
 * <pre>
 * tables:
 *   users:
 *     columns:
 *       id: { type: int, primaryKey: true, generated: true, default: database }
 *       name: string
 *       invitedBy: { type: int, nullable: true, dbName: invited_by }
 *     relations:
 *       posts: { kind: many, target: posts }
 *       inviter: { kind: one, target: users, from: invitedBy, to: id }
 *       groups: { kind: many_through, target: groups, through: { table: usersToGroups } }
 * </pre>
 */
public final class YamlSchemaLoader {
  private final ObjectMapper mapper;

  public YamlSchemaLoader() {
    this(new ObjectMapper(new YAMLFactory()));
  }

  public YamlSchemaLoader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public SchemaGraph load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new SchemaException("Failed to read schema file " + file, e);
    }
  }

  /** Loads a classpath resource using the context class loader. */
  public SchemaGraph loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = YamlSchemaLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new SchemaException("Schema resource not found: " + resource);
      return load(in);
    } catch (IOException e) {
      throw new SchemaException("Failed to read schema resource " + resource, e);
    }
  }

  public SchemaGraph load(InputStream in) throws IOException {
    JsonNode root = mapper.readTree(in);
    if (root == null || !root.isObject()) throw new SchemaException("Schema document must be a mapping");
    JsonNode tables = root.get("tables");
    if (tables == null || !tables.isObject()) throw new SchemaException("Schema document needs a 'tables' mapping");

    List<TableDef> out = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = tables.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.add(table(e.getKey(), e.getValue()));
    }
    return new SchemaGraph(out);
  }

  private TableDef table(String name, JsonNode n) {
    TableDef.Builder b = TableDef.builder(name).dbName(text(n, "dbName"));
    JsonNode cols = n.get("columns");
    if (cols == null || !cols.isObject()) throw new SchemaException("Table '" + name + "' needs a 'columns' mapping");
    Iterator<Map.Entry<String, JsonNode>> it = cols.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      b.column(column(name, e.getKey(), e.getValue()));
    }
    JsonNode rels = n.get("relations");
    if (rels != null && rels.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> rit = rels.fields();
      while (rit.hasNext()) {
        Map.Entry<String, JsonNode> e = rit.next();
        b.relation(relation(name, e.getKey(), e.getValue()));
      }
    }
    return b.build();
  }

  private static ColumnDef column(String table, String name, JsonNode n) {
    // shorthand: "name: string"
    if (n.isTextual()) return ColumnDef.of(name, n.asText());
    if (!n.isObject()) throw new SchemaException("Column '" + table + "." + name + "' must be a type name or a mapping");
    String def = text(n, "default");
    DefaultPolicy policy;
    try {
      policy = (def == null) ? DefaultPolicy.NONE : DefaultPolicy.valueOf(def.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Unknown default policy '" + def + "' on column '" + table + "." + name + "'");
    }
    return new ColumnDef(
        name,
        text(n, "dbName"),
        text(n, "type"),
        bool(n, "nullable", false),
        policy,
        bool(n, "generated", false),
        bool(n, "primaryKey", false)
    );
  }

  private RelationDef relation(String table, String name, JsonNode n) {
    String kindText = text(n, "kind");
    String target = text(n, "target");
    if (kindText == null || target == null) {
      throw new SchemaException("Relation '" + table + "." + name + "' needs kind and target");
    }
    RelationKind kind;
    try {
      kind = RelationKind.valueOf(kindText.toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Unknown relation kind '" + kindText + "' on '" + table + "." + name + "'");
    }

    ThroughDef through = null;
    JsonNode t = n.get("through");
    if (t != null && t.isTextual()) {
      through = ThroughDef.of(t.asText());
    } else if (t != null && t.isObject()) {
      String jt = text(t, "table");
      if (jt == null) throw new SchemaException("Junction of '" + table + "." + name + "' needs a table");
      through = new ThroughDef(jt, list(t, "sourceColumns"), list(t, "targetColumns"),
          text(t, "sourceRelation"), text(t, "targetRelation"));
    }

    Predicate where = null;
    JsonNode w = n.get("where");
    if (w != null && w.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = mapper.convertValue(w, Map.class);
      where = FilterParser.parse(m);
    }

    try {
      return new RelationDef(name, kind, target, list(n, "from"), list(n, "to"), through,
          bool(n, "optional", true), text(n, "alias"), where);
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Invalid relation '" + table + "." + name + "': " + e.getMessage(), e);
    }
  }

  private static List<String> list(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return List.of();
    if (v.isTextual()) return List.of(v.asText());
    List<String> out = new ArrayList<>();
    for (JsonNode x : v) out.add(x.asText());
    return out;
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }

  private static boolean bool(JsonNode n, String field, boolean def) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return def;
    return v.isBoolean() ? v.booleanValue() : Boolean.parseBoolean(v.asText());
  }
}
