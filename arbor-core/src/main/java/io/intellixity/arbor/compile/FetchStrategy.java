package io.intellixity.arbor.compile;

/** How to-many relations are fetched. */
public enum FetchStrategy {
  /** One statement; to-many relations are joined, limited ones through windowed derived tables. */
  JOIN,
  /** One statement per to-many level, keyed by the identities of the parent rows. */
  BATCH
}
