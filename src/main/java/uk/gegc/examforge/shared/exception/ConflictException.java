package uk.gegc.examforge.shared.exception;

/**
 * Thrown when another mutation on the same paper lineage is already in flight
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
