package io.intellixity.arbor.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.arbor.error.PredicateException;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Canonical JSON deserializer for {@link QuerySpec}.
 * <p>
 * {@code orderBy} accepts a list of {@code {column, dir}} objects or an object of {@code column: "asc"|"desc"};
 * {@code with} values are {@code true} (all columns) or a nested spec.
 */
public final class QuerySpecJsonDeserializer extends JsonDeserializer<QuerySpec> {
  @Override
  public QuerySpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseSpec(root, codec);
  }

  static QuerySpec parseSpec(JsonNode root, ObjectCodec codec) throws IOException {
    if (!root.isObject()) throw new PredicateException("Query JSON must be an object");
    QuerySpec.Builder b = QuerySpec.builder();

    String table = textOrNull(root.get("table"));
    if (table != null) b.table(table);

    JsonNode cols = root.get("columns");
    if (cols != null && cols.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = cols.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        if (e.getValue().asBoolean()) b.columns(e.getKey());
        else b.exclude(e.getKey());
      }
    }

    JsonNode where = root.get("where");
    if (where != null && !where.isNull()) {
      if (!where.isObject()) throw new PredicateException("where must be an object");
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(where, Map.class);
      b.where(FilterParser.parse(m));
    }

    JsonNode order = root.get("orderBy");
    if (order != null && order.isArray()) {
      for (JsonNode s : order) {
        String c = textOrNull(s.get("column"));
        if (c == null) throw new PredicateException("orderBy entries need a column");
        b.orderBy(new SortField(c, direction(textOrNull(s.get("dir")))));
      }
    } else if (order != null && order.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = order.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        b.orderBy(new SortField(e.getKey(), direction(e.getValue().asText())));
      }
    }

    Object limit = paging(root.get("limit"), "limit");
    if (limit instanceof Integer i) b.limit(i);
    else if (limit instanceof QueryValues.Param prm) b.limit(prm);

    Object offset = paging(root.get("offset"), "offset");
    if (offset instanceof Integer i) b.offset(i);
    else if (offset instanceof QueryValues.Param prm) b.offset(prm);

    JsonNode extras = root.get("extras");
    if (extras != null && extras.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = extras.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        b.extra(e.getKey(), FilterParser.parseExpr(codec.treeToValue(e.getValue(), Map.class)));
      }
    }

    JsonNode with = root.get("with");
    if (with != null && with.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = with.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        JsonNode v = e.getValue();
        if (v.isBoolean()) {
          if (v.booleanValue()) b.with(e.getKey());
        } else {
          b.with(e.getKey(), parseSpec(v, codec));
        }
      }
    }

    JsonNode first = root.get("first");
    if (first != null && first.asBoolean()) b.first();
    return b.build();
  }

  private static Object paging(JsonNode n, String name) {
    if (n == null || n.isNull()) return null;
    if (n.isInt()) return n.intValue();
    if (n.isObject()) {
      String p = textOrNull(n.get("$param"));
      if (p == null) p = textOrNull(n.get("param"));
      if (p != null) return QueryValues.param(p);
    }
    throw new PredicateException(name + " must be an integer or {\"$param\": name}");
  }

  private static SortField.Direction direction(String dir) {
    if (dir == null) return SortField.Direction.ASC;
    try {
      return SortField.Direction.valueOf(dir.toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new PredicateException("Unknown sort direction: " + dir);
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
