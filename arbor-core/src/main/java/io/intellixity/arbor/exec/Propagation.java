package io.intellixity.arbor.exec;

/**
 * Transaction propagation for {@link QueryEngine#inTx(Propagation, java.util.function.Supplier)}. Query execution
 * itself always uses {@link #REQUIRED}, so every statement of one request shares a transaction.
 */
public enum Propagation {
  /** Join the current transaction, or start one. */
  REQUIRED,

  /** Join the current transaction, or run without one. */
  SUPPORTS,

  /** Join the current transaction; fail when there is none. */
  MANDATORY,

  /** Always start a new transaction for the work. */
  REQUIRES_NEW,

  /** Run without a transaction; fail when one is active. */
  NEVER
}
