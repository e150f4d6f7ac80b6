package io.intellixity.arbor.spi.sql;

import io.intellixity.arbor.compile.FetchStrategy;
import io.intellixity.arbor.selectast.SelectAst;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveredDialectRegistryTest {
  private record NamedDialect(String id, FetchStrategy preferredStrategy) implements SqlDialect {
    @Override
    public SqlStatement render(SelectAst select, String namespace, int batchSize) {
      return new SqlStatement(id, List.of());
    }
  }

  private record Provider(String dialectId, FetchStrategy strategy) implements DialectProvider {
    @Override
    public SqlDialect create() { return new NamedDialect(dialectId, strategy); }
  }

  @Test
  void firstProviderPerIdWins() {
    DiscoveredDialectRegistry r = new DiscoveredDialectRegistry(Arrays.asList(
        new Provider("pg", FetchStrategy.JOIN),
        null,
        new Provider(" ", FetchStrategy.BATCH),
        new Provider("pg", FetchStrategy.BATCH),
        new Provider("ansi", FetchStrategy.BATCH)));

    assertEquals(List.of("pg", "ansi"), List.copyOf(r.ids()));
    assertEquals(FetchStrategy.JOIN, r.get("pg").preferredStrategy());
  }

  @Test
  void unknownIdNamesTheKnownOnes() {
    DiscoveredDialectRegistry r = new DiscoveredDialectRegistry(List.of(new Provider("ansi", FetchStrategy.BATCH)));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> r.get("oracle"));
    assertTrue(ex.getMessage().contains("[ansi]"));
  }
}
