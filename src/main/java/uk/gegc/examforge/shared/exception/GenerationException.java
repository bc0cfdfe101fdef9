package uk.gegc.examforge.shared.exception;

/**
 * Thrown when the question generator or the insight generator fails
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
