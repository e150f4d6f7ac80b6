package io.intellixity.arbor.exec;

import io.intellixity.arbor.compile.QueryPlan;
import io.intellixity.arbor.exec.handle.EngineHandle;
import io.intellixity.arbor.query.Expr;
import io.intellixity.arbor.query.Filters;
import io.intellixity.arbor.query.QuerySpec;
import io.intellixity.arbor.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

final class FindRequestTest {
  private record NoopHandle() implements EngineHandle<Object> {
    @Override public String id() { return "noop"; }
    @Override public Object client() { return new Object(); }
    @Override public String namespace() { return null; }
  }

  /** Records executed specs and answers with a fixed result. */
  private static final class RecordingEngine implements QueryEngine<NoopHandle> {
    private final List<QuerySpec> executed = new ArrayList<>();
    private final List<Map<String, ?>> bindings = new ArrayList<>();
    private final List<Map<String, Object>> result;

    RecordingEngine(List<Map<String, Object>> result) {
      this.result = result;
    }

    @Override public NoopHandle handle() { return new NoopHandle(); }
    @Override public Propagation defaultPropagation() { return Propagation.SUPPORTS; }
    @Override public <T> T inTx(Propagation propagation, Supplier<T> work) { return work.get(); }

    @Override
    public PreparedQuery prepare(QuerySpec spec) {
      return new PreparedQuery() {
        @Override public QueryPlan plan() { throw new UnsupportedOperationException(); }
        @Override public Map<String, String> placeholders() { return Map.of(); }
        @Override public ExecutionState state() { return ExecutionState.PREPARED; }

        @Override
        public List<Map<String, Object>> execute(Map<String, ?> b) {
          executed.add(spec);
          bindings.add(b);
          return result;
        }

        @Override
        public CompletableFuture<List<Map<String, Object>>> executeAsync(Map<String, ?> b) {
          return CompletableFuture.completedFuture(execute(b));
        }
      };
    }
  }

  @Test
  void buildsNestedSpec() {
    RecordingEngine engine = new RecordingEngine(List.of());
    QuerySpec spec = engine.find("users")
        .where(Filters.eq("name", "alice"))
        .with("posts", b -> b.orderBy(SortField.desc("id")).limit(1))
        .with("groups")
        .orderBy(SortField.asc("name"))
        .limit(10)
        .offset(Filters.param("skip"))
        .exclude("invitedBy")
        .extra("postCount", Expr.count("posts"))
        .spec();

    QuerySpec expected = QuerySpec.builder("users")
        .where(Filters.eq("name", "alice"))
        .with("posts", QuerySpec.builder().orderBy(SortField.desc("id")).limit(1).build())
        .with("groups", QuerySpec.all())
        .orderBy(SortField.asc("name"))
        .limit(10)
        .offset(Filters.param("skip"))
        .exclude("invitedBy")
        .extra("postCount", Expr.count("posts"))
        .build();
    assertEquals(expected, spec);
  }

  @Test
  void mapFilterIsParsed() {
    RecordingEngine engine = new RecordingEngine(List.of());
    QuerySpec spec = engine.find("users").where(Map.of("posts", Map.of("$exists", true))).spec();
    assertEquals(Filters.has("posts"), spec.where());
  }

  @Test
  void executePassesBindings() {
    RecordingEngine engine = new RecordingEngine(List.of(Map.of("id", 1)));
    List<Map<String, Object>> out = engine.find("users").where(Filters.eq("id", Filters.param("id"))).execute(Map.of("id", 1));
    assertEquals(1, out.size());
    assertEquals(Map.of("id", 1), engine.bindings.get(0));
  }

  @Test
  void findOneRequestsSingleRoot() {
    RecordingEngine engine = new RecordingEngine(List.of(Map.of("id", 1)));
    Optional<Map<String, Object>> one = engine.find("users").findOne();
    assertTrue(one.isPresent());
    assertTrue(engine.executed.get(0).first());

    RecordingEngine empty = new RecordingEngine(List.of());
    assertTrue(empty.find("users").findOne().isEmpty());
  }

  @Test
  void jsonRequestsRunThroughTheSameEngine() {
    RecordingEngine engine = new RecordingEngine(List.of());
    engine.executeJson("{\"table\":\"users\",\"with\":{\"posts\":true}}", Map.of());
    assertEquals(QuerySpec.builder("users").with("posts").build(), engine.executed.get(0));
  }
}
