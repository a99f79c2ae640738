package uk.gegc.mcqgen.shared.exception;

/**
 * Exception thrown when a generation result cannot be rendered to its published form
 */
public class McqExportException extends RuntimeException {

    public McqExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
