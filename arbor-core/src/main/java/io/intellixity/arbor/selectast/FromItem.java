package io.intellixity.arbor.selectast;

import java.util.Objects;

public interface FromItem {
  String alias();

  /** Physical table; dialects qualify it with the engine namespace when one is set. */
  record Table(String name, String alias) implements FromItem {
    public Table {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(alias, "alias");
    }
  }

  record Derived(SelectAst query, String alias) implements FromItem {
    public Derived {
      Objects.requireNonNull(query, "query");
      Objects.requireNonNull(alias, "alias");
    }
  }
}
