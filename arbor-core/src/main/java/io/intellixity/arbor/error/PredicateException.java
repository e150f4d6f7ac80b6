package io.intellixity.arbor.error;

/** Malformed filter or selection shape (unknown operator, wrong operand shape, empty selection). */
public final class PredicateException extends ArborException {
  public PredicateException(String message) {
    super(message);
  }
}
