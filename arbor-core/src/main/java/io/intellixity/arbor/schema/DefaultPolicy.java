package io.intellixity.arbor.schema;

/** Where a column's value comes from when a row is written without it. */
public enum DefaultPolicy {
  NONE,
  /** Database-side default or sequence. */
  DATABASE,
  /** Supplied by the application before the write. */
  APPLICATION
}
