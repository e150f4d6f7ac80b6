package io.intellixity.arbor.mapping;

/** Read access to one result row by label. */
public interface RowAdapter {
  boolean has(String label);

  /** Value of {@code label}; a label the row does not carry is a {@link io.intellixity.arbor.error.ReconstructionException}. */
  Object raw(String label);

  default boolean isNull(String label) { return raw(label) == null; }
}
