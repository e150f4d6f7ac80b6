package io.intellixity.arbor.catalog;

import io.intellixity.arbor.compile.QueryPlanner;
import io.intellixity.arbor.relation.RelationResolver;
import io.intellixity.arbor.schema.SchemaGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Process-wide holder of the schema graph and the caches derived from it.
 * <p>
 * The graph is loaded lazily on first use, once, under a lock. {@link #reload()} swaps graph, resolver and planner
 * together and then notifies invalidation listeners (engines clear their plan caches there).
 */
public final class SchemaCatalog {
  private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

  private final Supplier<SchemaGraph> source;
  private final Object lock = new Object();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private volatile Snapshot current;

  /** Graph, resolver and planner of one schema generation. */
  public record Snapshot(SchemaGraph graph, RelationResolver resolver, QueryPlanner planner, long generation) {}

  public SchemaCatalog(Supplier<SchemaGraph> source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public static SchemaCatalog of(SchemaGraph graph) {
    Objects.requireNonNull(graph, "graph");
    return new SchemaCatalog(() -> graph);
  }

  public Snapshot snapshot() {
    Snapshot s = current;
    if (s != null) return s;
    synchronized (lock) {
      if (current == null) current = load(1);
      return current;
    }
  }

  public SchemaGraph graph() { return snapshot().graph(); }

  public RelationResolver resolver() { return snapshot().resolver(); }

  public QueryPlanner planner() { return snapshot().planner(); }

  /** Re-reads the schema from its source and invalidates everything derived from the previous one. */
  public void reload() {
    synchronized (lock) {
      long next = (current == null) ? 1 : current.generation() + 1;
      Snapshot previous = current;
      current = load(next);
      if (previous != null) previous.resolver().invalidate();
    }
    for (Runnable l : listeners) l.run();
  }

  public void addInvalidationListener(Runnable listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  private Snapshot load(long generation) {
    SchemaGraph graph = Objects.requireNonNull(source.get(), "schema source returned null");
    RelationResolver resolver = new RelationResolver(graph);
    log.info("arbor.schema loaded generation={} tables={}", generation, graph.tables().size());
    return new Snapshot(graph, resolver, new QueryPlanner(resolver), generation);
  }
}
