package nadra;

/**
 * Base of every error raised while translating a Nadra script.
 * Each pipeline stage throws its own subtype and stops at the first problem.
 */
public class NadraException extends RuntimeException {

    public NadraException(String message) {
        super(message);
    }

    public NadraException(String message, Throwable cause) {
        super(message, cause);
    }
}
