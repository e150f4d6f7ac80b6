package io.intellixity.arbor.error;

/**
 * Base type for every error raised by the query engine.
 * <p>
 * Subtypes identify the stage that failed: schema resolution, predicate translation, placeholder binding,
 * row reconstruction or statement transport.
 */
public class ArborException extends RuntimeException {
  public ArborException(String message) {
    super(message);
  }

  public ArborException(String message, Throwable cause) {
    super(message, cause);
  }
}
