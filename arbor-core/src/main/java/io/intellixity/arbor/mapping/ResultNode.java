package io.intellixity.arbor.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Object under reconstruction: fetched values plus one insertion-ordered container per loaded relation. */
public final class ResultNode {
  private final int nodeId;
  private final Map<String, Object> values;
  private final Map<String, Map<IdentityKey, ResultNode>> relations = new LinkedHashMap<>();

  ResultNode(int nodeId, Map<String, Object> values) {
    this.nodeId = nodeId;
    this.values = values;
  }

  public int nodeId() { return nodeId; }

  public Object value(String column) { return values.get(column); }

  public Map<String, Object> values() { return Collections.unmodifiableMap(values); }

  /** Container for {@code relation}, created empty on first access. */
  Map<IdentityKey, ResultNode> relation(String relation) {
    return relations.computeIfAbsent(relation, k -> new LinkedHashMap<>());
  }

  Map<IdentityKey, ResultNode> relationOrNull(String relation) {
    return relations.get(relation);
  }
}
