package io.intellixity.arbor.query;

import io.intellixity.arbor.error.PredicateException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FilterParserTest {
  @Test
  void scalarValueIsEquality() {
    assertEquals(Filters.eq("name", "alice"), FilterParser.parse(Map.of("name", "alice")));
  }

  @Test
  void nullValueIsNullCheck() {
    Map<String, Object> m = new HashMap<>();
    m.put("invitedBy", null);
    assertEquals(Filters.isNull("invitedBy"), FilterParser.parse(m));
  }

  @Test
  void siblingKeysCombineWithAnd() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("name", "alice");
    m.put("id", Map.of("gt", 3));
    LogicalGroup g = assertInstanceOf(LogicalGroup.class, FilterParser.parse(m));
    assertEquals(Clause.AND, g.clause());
    assertEquals(List.of(Filters.eq("name", "alice"), Filters.gt("id", 3)), g.elements());
  }

  @Test
  void operatorsOnOneColumnCombineWithAnd() {
    Map<String, Object> ops = new LinkedHashMap<>();
    ops.put("gte", 18);
    ops.put("lt", 65);
    Predicate p = FilterParser.parse(Map.of("age", ops));
    assertEquals(Filters.and(Filters.gte("age", 18), Filters.lt("age", 65)), p);
  }

  @Test
  void logicalKeysAtTopLevel() {
    Map<String, Object> m = Map.of("OR", List.of(Map.of("name", "a"), Map.of("NOT", Map.of("name", "b"))));
    assertEquals(Filters.or(Filters.eq("name", "a"), Filters.not(Filters.eq("name", "b"))), FilterParser.parse(m));
  }

  @Test
  void logicalKeysInsideColumnFilter() {
    Map<String, Object> m = Map.of("id", Map.of("OR", List.of(Map.of("lt", 2), Map.of("gt", 8))));
    assertEquals(Filters.or(Filters.lt("id", 2), Filters.gt("id", 8)), FilterParser.parse(m));
  }

  @Test
  void placeholdersInValuesAndLists() {
    Map<String, Object> m = Map.of("id", Map.of("in", List.of(1, Map.of("$param", "other"))));
    Condition c = assertInstanceOf(Condition.class, FilterParser.parse(m));
    assertEquals(Operator.IN, c.operator());
    assertEquals(List.of(1, QueryValues.param("other")), c.value());

    assertEquals(Filters.eq("name", Filters.param("who")), FilterParser.parse(Map.of("name", Map.of("$param", "who"))));
  }

  @Test
  void relationFilters() {
    assertEquals(Filters.has("posts"), FilterParser.parse(Map.of("posts", Map.of("$exists", true))));
    assertEquals(Filters.hasNo("posts"), FilterParser.parse(Map.of("posts", Map.of("$exists", false))));

    Predicate nested = FilterParser.parse(Map.of("posts", Map.of("content", Map.of("like", "%db%"))));
    assertEquals(Filters.has("posts", Filters.like("content", "%db%")), nested);
  }

  @Test
  void betweenTakesTwoBounds() {
    assertEquals(Filters.between("id", 1, 5), FilterParser.parse(Map.of("id", Map.of("between", List.of(1, 5)))));
    assertThrows(PredicateException.class, () -> FilterParser.parse(Map.of("id", Map.of("between", List.of(1)))));
  }

  @Test
  void columnSubquery() {
    Map<String, Object> sub = Map.of("$subquery", Map.of("table", "posts", "column", "ownerId"));
    Condition c = assertInstanceOf(Condition.class, FilterParser.parse(Map.of("id", Map.of("notIn", sub))));
    assertEquals(new ColumnSubquery("posts", "ownerId", null), c.value());
  }

  @Test
  void malformedShapesAreRejected() {
    assertThrows(PredicateException.class, () -> FilterParser.parse(Map.of("id", List.of(1, 2))));
    assertThrows(PredicateException.class, () -> FilterParser.parse(Map.of("id", Map.of("in", 3))));
    assertThrows(PredicateException.class, () -> FilterParser.parse(Map.of("OR", Map.of("a", 1))));
    assertThrows(PredicateException.class, () -> FilterParser.parse(Map.of("posts", Map.of("eq", 1, "content", "x"))));
    assertThrows(PredicateException.class, () -> FilterParser.parse(Map.of("posts", Map.of("$exists", true, "id", 1))));
    assertThrows(PredicateException.class, () -> FilterParser.parse(Map.of("posts", Map.of("$exists", "yes"))));
  }

  @Test
  void emptyFilterIsNoConstraint() {
    assertNull(FilterParser.parse(Map.of()));
    assertNull(FilterParser.parse(null));
  }

  @Test
  void writerOutputParsesBack() {
    Predicate p = Filters.and(
        Filters.eq("name", "alice"),
        Filters.in("id", List.of(1, 2)),
        Filters.has("posts", Filters.ilike("content", Filters.param("q"))),
        Filters.not(Filters.isNull("invitedBy")));
    assertEquals(p, FilterParser.parse(FilterWriter.toMap(p)));
  }
}
