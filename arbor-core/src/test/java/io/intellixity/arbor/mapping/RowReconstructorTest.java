package io.intellixity.arbor.mapping;

import io.intellixity.arbor.compile.FetchStrategy;
import io.intellixity.arbor.compile.PlannedStatement;
import io.intellixity.arbor.compile.QueryPlan;
import io.intellixity.arbor.compile.QueryPlanner;
import io.intellixity.arbor.error.ReconstructionException;
import io.intellixity.arbor.query.Expr;
import io.intellixity.arbor.query.QuerySpec;
import io.intellixity.arbor.relation.RelationResolver;
import io.intellixity.arbor.schema.yaml.YamlSchemaLoader;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RowReconstructorTest {
  private static final QueryPlanner PLANNER =
      new QueryPlanner(new RelationResolver(new YamlSchemaLoader().loadResource("schema/blog.yaml")));

  @Test
  void foldsJoinedRowsWithoutDuplicates() {
    QueryPlan plan = PLANNER.plan(QuerySpec.builder("users").columns("name").with("posts", b -> b.columns("content")).build(),
        FetchStrategy.JOIN);
    RowReconstructor r = new RowReconstructor(plan);
    r.acceptRoot(plan.statements().get(0), RowAdapters.fromMaps(List.of(
        userPostRow(1, "alice", 10, "a"),
        userPostRow(1, "alice", 11, "b"),
        userPostRow(1, "alice", 10, "a"),
        userPostRow(2, "bob", null, null))));

    List<Map<String, Object>> out = r.result();
    assertEquals(2, out.size());
    Map<String, Object> alice = out.get(0);
    assertEquals(List.of("name", "posts"), new ArrayList<>(alice.keySet()));
    assertEquals(List.of(Map.of("content", "a"), Map.of("content", "b")), alice.get("posts"));
    assertEquals(List.of(), out.get(1).get("posts"));
  }

  @Test
  void missingOneRelationIsNull() {
    QueryPlan plan = PLANNER.plan(QuerySpec.builder("users").columns("name").with("inviter", b -> b.columns("name")).build(),
        FetchStrategy.JOIN);
    RowReconstructor r = new RowReconstructor(plan);
    r.acceptRoot(plan.statements().get(0), RowAdapters.fromMaps(List.of(
        row("n0.id", 1, "n0.name", "alice", "n0.invitedBy", null, "n1.id", null, "n1.name", null),
        row("n0.id", 2, "n0.name", "bob", "n0.invitedBy", 1, "n1.id", 1, "n1.name", "alice"))));

    List<Map<String, Object>> out = r.result();
    assertNull(out.get(0).get("inviter"));
    assertTrue(out.get(0).containsKey("inviter"));
    assertEquals(Map.of("name", "alice"), out.get(1).get("inviter"));
  }

  @Test
  void attachesBatchRowsToEveryMatchingParent() {
    QueryPlan plan = PLANNER.plan(QuerySpec.builder("users").columns("name").with("posts", b -> b.columns("content")).build(),
        FetchStrategy.BATCH);
    PlannedStatement root = plan.statements().get(0);
    PlannedStatement posts = plan.statements().get(1);
    RowReconstructor r = new RowReconstructor(plan);
    r.acceptRoot(root, RowAdapters.fromMaps(List.of(
        row("n0.id", 1, "n0.name", "alice"),
        row("n0.id", 2, "n0.name", "bob"),
        row("n0.id", 3, "n0.name", "carol"))));

    assertEquals(List.of(List.of(1), List.of(2), List.of(3)), r.parentKeys(posts));

    // keys come back widened to long; they still match the int parent ids
    r.acceptChildren(posts, RowAdapters.fromMaps(List.of(
        row("n1.id", 10, "n1.content", "a", "n1#k0", 1L),
        row("n1.id", 11, "n1.content", "b", "n1#k0", 1L),
        row("n1.id", 20, "n1.content", "c", "n1#k0", 2L))));

    List<Map<String, Object>> out = r.result();
    assertEquals(2, ((List<?>) out.get(0).get("posts")).size());
    assertEquals(List.of(Map.of("content", "c")), out.get(1).get("posts"));
    assertEquals(List.of(), out.get(2).get("posts"));
  }

  @Test
  void extrasFollowColumns() {
    QueryPlan plan = PLANNER.plan(QuerySpec.builder("users").columns("name").extra("postCount", Expr.count("posts")).build(),
        FetchStrategy.JOIN);
    RowReconstructor r = new RowReconstructor(plan);
    r.acceptRoot(plan.statements().get(0), RowAdapters.fromMaps(List.of(
        row("n0.id", 1, "n0.name", "alice", "n0$postCount", 2L))));
    Map<String, Object> alice = r.result().get(0);
    assertEquals(List.of("name", "postCount"), new ArrayList<>(alice.keySet()));
    assertEquals(2L, alice.get("postCount"));
  }

  @Test
  void missingLabelIsReconstructionError() {
    QueryPlan plan = PLANNER.plan(QuerySpec.builder("users").build(), FetchStrategy.JOIN);
    RowReconstructor r = new RowReconstructor(plan);
    List<RowAdapter> rows = RowAdapters.fromMaps(List.of(row("n0.id", 1)));
    assertThrows(ReconstructionException.class, () -> r.acceptRoot(plan.statements().get(0), rows));
  }

  private static Map<String, Object> userPostRow(int userId, String name, Integer postId, String content) {
    return row("n0.id", userId, "n0.name", name, "n1.id", postId, "n1.ownerId", postId == null ? null : userId,
        "n1.content", content);
  }

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new HashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }
}
