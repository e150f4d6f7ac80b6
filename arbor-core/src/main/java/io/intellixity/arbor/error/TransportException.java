package io.intellixity.arbor.error;

/** Statement execution failed in the backend; the driver error is kept as the cause. */
public final class TransportException extends ArborException {
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
