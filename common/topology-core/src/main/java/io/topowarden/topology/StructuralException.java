package io.topowarden.topology;

/**
 * Raised when a topology record is missing a required identity field or a snapshot document does
 * not have the expected shape. Always fatal for the command that triggered it.
 */
public class StructuralException extends RuntimeException {

  public StructuralException(String message) {
    super(message);
  }

  public StructuralException(String message, Throwable cause) {
    super(message, cause);
  }

  static String requireIdentity(String value, String kind, String field) {
    if (value == null) {
      throw new StructuralException(kind + " record is missing required field '" + field + "'");
    }
    return value;
  }
}
