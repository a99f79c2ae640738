package uk.gegc.mcqgen.shared.exception;

/**
 * Exception thrown when the text generation service is unreachable, times out or returns an error
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
