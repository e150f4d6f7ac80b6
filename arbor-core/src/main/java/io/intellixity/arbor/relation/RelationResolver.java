package io.intellixity.arbor.relation;

import io.intellixity.arbor.error.AmbiguousRelationException;
import io.intellixity.arbor.error.SchemaException;
import io.intellixity.arbor.schema.RelationDef;
import io.intellixity.arbor.schema.RelationKind;
import io.intellixity.arbor.schema.SchemaGraph;
import io.intellixity.arbor.schema.TableDef;
import io.intellixity.arbor.schema.ThroughDef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves declared relations into {@link JoinDescriptor}s and caches them per (table, relation).
 * <p>
 * Omitted mappings are inferred in a fixed order: declared mapping, then name-based matching (relation aliases for
 * direct relations, table/relation names for junction relations), then uniqueness of the structural candidate.
 * More than one remaining candidate is an {@link AmbiguousRelationException}.
 */
public final class RelationResolver {
  private final SchemaGraph graph;
  private final Map<CacheKey, JoinDescriptor> cache = new ConcurrentHashMap<>();

  private record CacheKey(String table, String relation) {}

  public RelationResolver(SchemaGraph graph) {
    this.graph = Objects.requireNonNull(graph, "graph");
  }

  public SchemaGraph graph() { return graph; }

  public JoinDescriptor resolve(String table, String relation) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(relation, "relation");
    return cache.computeIfAbsent(new CacheKey(table, relation), k -> compute(k.table(), k.relation()));
  }

  /** Drops cached descriptors; the next {@link #resolve} recomputes them. */
  public void invalidate() {
    cache.clear();
  }

  private JoinDescriptor compute(String tableName, String relationName) {
    TableDef source = graph.table(tableName);
    RelationDef r = source.relation(relationName);
    TableDef target = graph.table(r.target());
    if (r.kind() == RelationKind.MANY_THROUGH) {
      Junction j = junction(source, target, r);
      return new JoinDescriptor(source.name(), r.name(), target.name(), r.kind(), List.of(), j, true, r.where());
    }
    List<JoinKey> keys = directKeys(source, target, r);
    boolean optional = r.kind() != RelationKind.ONE || r.optional();
    return new JoinDescriptor(source.name(), r.name(), target.name(), r.kind(), keys, null, optional, r.where());
  }

  private List<JoinKey> directKeys(TableDef source, TableDef target, RelationDef r) {
    if (r.hasDeclaredColumns()) return zip(r.fromColumns(), r.toColumns());

    List<RelationDef> reverse = new ArrayList<>();
    for (RelationDef c : target.relations().values()) {
      if (c.kind() == RelationKind.MANY_THROUGH) continue;
      if (!c.target().equals(source.name())) continue;
      if (target.name().equals(source.name()) && c.name().equals(r.name())) continue;
      if (!c.hasDeclaredColumns()) continue;
      reverse.add(c);
    }

    if (r.alias() != null) {
      List<RelationDef> named = new ArrayList<>();
      for (RelationDef c : reverse) if (r.alias().equals(c.alias())) named.add(c);
      if (named.size() == 1) return reversed(named.get(0));
      if (named.size() > 1) throw new AmbiguousRelationException(source.name(), r.name(), qualified(target, named));
      throw new SchemaException("No relation on '" + target.name() + "' with alias '" + r.alias()
          + "' and declared columns to pair with '" + source.name() + "." + r.name() + "'");
    }

    if (reverse.size() == 1) return reversed(reverse.get(0));
    if (reverse.isEmpty()) {
      throw new SchemaException("Cannot infer join columns for '" + source.name() + "." + r.name()
          + "': declare from/to or a reverse relation on '" + target.name() + "'");
    }
    throw new AmbiguousRelationException(source.name(), r.name(), qualified(target, reverse));
  }

  /** Reverse relation lives on the target: its from-columns are target columns, its to-columns source columns. */
  private static List<JoinKey> reversed(RelationDef reverse) {
    return zip(reverse.toColumns(), reverse.fromColumns());
  }

  private Junction junction(TableDef source, TableDef target, RelationDef r) {
    ThroughDef t = r.through();
    TableDef junction = graph.table(t.table());

    if (t.hasDeclaredColumns()) {
      if (!r.hasDeclaredColumns()) {
        throw new SchemaException("Relation '" + source.name() + "." + r.name()
            + "' declares junction columns but no from/to columns");
      }
      return new Junction(junction.name(), zip(r.fromColumns(), t.sourceColumns()), zip(t.targetColumns(), r.toColumns()));
    }

    RelationDef toSource;
    RelationDef toTarget;
    if (t.hasDeclaredRelations()) {
      toSource = junctionRelation(junction, t.sourceRelation(), source, r);
      toTarget = junctionRelation(junction, t.targetRelation(), target, r);
    } else {
      List<RelationDef> sourceCandidates = oneRelationsTo(junction, source.name());
      toSource = pick(sourceCandidates, hints(source.name(), r.alias()));
      List<RelationDef> targetCandidates = oneRelationsTo(junction, target.name());
      if (toSource != null) targetCandidates.remove(toSource);
      toTarget = pick(targetCandidates, hints(target.name(), r.name()));

      if (sourceCandidates.isEmpty() || targetCandidates.isEmpty()) {
        throw new SchemaException("Junction '" + junction.name() + "' has no relation to '"
            + (sourceCandidates.isEmpty() ? source.name() : target.name()) + "' for '" + source.name() + "." + r.name() + "'");
      }
      if (toSource == null || toTarget == null) {
        List<RelationDef> all = new ArrayList<>(sourceCandidates);
        for (RelationDef c : targetCandidates) if (!all.contains(c)) all.add(c);
        throw new AmbiguousRelationException(source.name(), r.name(), qualified(junction, all));
      }
    }
    requireColumns(junction, toSource, r);
    requireColumns(junction, toTarget, r);
    return new Junction(junction.name(),
        zip(toSource.toColumns(), toSource.fromColumns()),
        zip(toTarget.fromColumns(), toTarget.toColumns()));
  }

  private static RelationDef junctionRelation(TableDef junction, String name, TableDef expected, RelationDef owner) {
    RelationDef rel = junction.relation(name);
    if (rel.kind() != RelationKind.ONE || !rel.target().equals(expected.name())) {
      throw new SchemaException("Junction relation '" + junction.name() + "." + name + "' of '" + owner.name()
          + "' must be a ONE relation to '" + expected.name() + "'");
    }
    return rel;
  }

  private static List<RelationDef> oneRelationsTo(TableDef junction, String table) {
    List<RelationDef> out = new ArrayList<>();
    for (RelationDef c : junction.relations().values()) {
      if (c.kind() == RelationKind.ONE && c.target().equals(table)) out.add(c);
    }
    return out;
  }

  /** Single name match wins, else a single candidate; null when neither rule decides. */
  private static RelationDef pick(List<RelationDef> candidates, Set<String> names) {
    RelationDef match = null;
    int matches = 0;
    for (RelationDef c : candidates) {
      if (names.contains(c.name())) {
        match = c;
        matches++;
      }
    }
    if (matches == 1) return match;
    return candidates.size() == 1 ? candidates.get(0) : null;
  }

  private static Set<String> hints(String tableName, String relationName) {
    Set<String> out = new HashSet<>();
    out.add(tableName);
    out.add(singular(tableName));
    if (relationName != null) {
      out.add(relationName);
      out.add(singular(relationName));
    }
    return out;
  }

  private static String singular(String name) {
    return (name.length() > 1 && name.endsWith("s")) ? name.substring(0, name.length() - 1) : name;
  }

  private static void requireColumns(TableDef junction, RelationDef rel, RelationDef owner) {
    if (!rel.hasDeclaredColumns()) {
      throw new SchemaException("Junction relation '" + junction.name() + "." + rel.name() + "' used by '"
          + owner.name() + "' must declare from/to columns");
    }
  }

  private static List<JoinKey> zip(List<String> left, List<String> right) {
    if (left.size() != right.size() || left.isEmpty()) {
      throw new SchemaException("Join column lists must be non-empty and of equal length: " + left + " / " + right);
    }
    List<JoinKey> out = new ArrayList<>(left.size());
    for (int i = 0; i < left.size(); i++) out.add(new JoinKey(left.get(i), right.get(i)));
    return out;
  }

  private static List<String> qualified(TableDef table, List<RelationDef> rels) {
    List<String> out = new ArrayList<>();
    for (RelationDef r : rels) out.add(table.name() + "." + r.name());
    return out;
  }
}
