package uk.gegc.mathassessment.shared.exception;

/**
 * Exception thrown when an exported assessment cannot be rendered or written
 */
public class AssessmentExportException extends RuntimeException {

    public AssessmentExportException(String message) {
        super(message);
    }

    public AssessmentExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
