package io.intellixity.arbor.exec;

/** Backend transaction opened by an engine; engines downcast to their own implementation. */
public interface TxHandle {
}
