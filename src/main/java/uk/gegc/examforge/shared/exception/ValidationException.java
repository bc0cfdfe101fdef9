package uk.gegc.examforge.shared.exception;

/**
 * Thrown when a request is malformed or its numbers are inconsistent
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
