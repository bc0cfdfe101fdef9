package uk.gegc.examforge.shared.exception;

/**
 * Thrown when the document renderer fails to produce an artifact
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
