package uk.gegc.mathassessment.shared.exception;

/**
 * Exception thrown when a raw text-generator reply holds no parseable JSON object
 */
public class AIResponseParseException extends RuntimeException {

    public AIResponseParseException(String message) {
        super(message);
    }

    public AIResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
