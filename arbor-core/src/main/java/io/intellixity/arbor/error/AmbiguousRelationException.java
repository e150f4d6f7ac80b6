package io.intellixity.arbor.error;

import java.util.List;

/** More than one structurally valid mapping exists for a relation and nothing in the schema picks one. */
public final class AmbiguousRelationException extends SchemaException {
  private final String table;
  private final String relation;
  private final List<String> candidates;

  public AmbiguousRelationException(String table, String relation, List<String> candidates) {
    super("Ambiguous relation '" + relation + "' on table '" + table + "': candidates " + candidates
        + "; declare the mapping explicitly or set a matching alias");
    this.table = table;
    this.relation = relation;
    this.candidates = List.copyOf(candidates);
  }

  public String table() { return table; }
  public String relation() { return relation; }
  public List<String> candidates() { return candidates; }
}
