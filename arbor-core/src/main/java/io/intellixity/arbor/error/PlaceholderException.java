package io.intellixity.arbor.error;

import java.util.Set;

/** Placeholder binding problems: unbound names at execution or one name used with conflicting types. */
public final class PlaceholderException extends ArborException {
  private final Set<String> names;

  public PlaceholderException(String message, Set<String> names) {
    super(message);
    this.names = Set.copyOf(names);
  }

  public Set<String> names() { return names; }
}
