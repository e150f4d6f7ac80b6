package io.intellixity.arbor.error;

/** A row does not carry the columns the plan expects (transport or dialect mismatch). */
public final class ReconstructionException extends ArborException {
  public ReconstructionException(String message) {
    super(message);
  }
}
