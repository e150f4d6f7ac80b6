package io.intellixity.arbor.exec;

public enum ExecutionState {
  UNPREPARED,
  PREPARED,
  EXECUTING,
  COMPLETED,
  FAILED
}
