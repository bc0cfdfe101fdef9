package uk.gegc.examforge.shared.exception;

/**
 * Thrown when an operation is not allowed in the paper's current lifecycle state
 */
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
