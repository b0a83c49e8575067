package io.topowarden.tools.topologycli;

/**
 * Exception thrown when command-line input is invalid.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
