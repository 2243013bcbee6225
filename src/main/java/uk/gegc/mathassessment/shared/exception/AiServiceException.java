package uk.gegc.mathassessment.shared.exception;

/**
 * Exception thrown when a text-generator backend encounters an error
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
