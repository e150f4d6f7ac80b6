package io.intellixity.arbor.error;

/** Raised for unknown tables, columns or relations and for relation mappings that cannot be resolved. */
public class SchemaException extends ArborException {
  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
