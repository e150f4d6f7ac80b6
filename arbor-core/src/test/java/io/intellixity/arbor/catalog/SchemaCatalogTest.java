package io.intellixity.arbor.catalog;

import io.intellixity.arbor.schema.SchemaGraph;
import io.intellixity.arbor.schema.TableDef;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaCatalogTest {
  @Test
  void loadsLazilyOnce() {
    AtomicInteger loads = new AtomicInteger();
    SchemaCatalog catalog = new SchemaCatalog(() -> {
      loads.incrementAndGet();
      return SchemaGraph.of(TableDef.builder("a").id("id", "int").build());
    });
    assertEquals(0, loads.get());
    assertTrue(catalog.graph().hasTable("a"));
    assertSame(catalog.planner(), catalog.planner());
    assertEquals(1, loads.get());
    assertEquals(1, catalog.snapshot().generation());
  }

  @Test
  void reloadSwapsSnapshotAndNotifiesListeners() {
    AtomicInteger loads = new AtomicInteger();
    SchemaCatalog catalog = new SchemaCatalog(() ->
        SchemaGraph.of(TableDef.builder("t" + loads.incrementAndGet()).id("id", "int").build()));
    AtomicInteger invalidations = new AtomicInteger();
    catalog.addInvalidationListener(invalidations::incrementAndGet);

    SchemaCatalog.Snapshot before = catalog.snapshot();
    catalog.reload();
    SchemaCatalog.Snapshot after = catalog.snapshot();

    assertEquals(1, invalidations.get());
    assertEquals(2, after.generation());
    assertNotSame(before.resolver(), after.resolver());
    assertTrue(after.graph().hasTable("t2"));
    assertFalse(after.graph().hasTable("t1"));
  }
}
