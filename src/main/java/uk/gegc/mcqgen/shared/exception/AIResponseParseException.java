package uk.gegc.mcqgen.shared.exception;

/**
 * Exception thrown when an AI response does not match the expected structured grammar
 */
public class AIResponseParseException extends RuntimeException {

    public AIResponseParseException(String message) {
        super(message);
    }

    public AIResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
