package dev.shelfscan.inventory;

/**
 * Raised when an external collaborator (AI model, document store) fails or returns unusable data.
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
