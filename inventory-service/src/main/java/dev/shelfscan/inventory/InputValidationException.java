package dev.shelfscan.inventory;

/**
 * Raised when a request or item fails validation at the service boundary.
 */
public class InputValidationException extends RuntimeException {

    public InputValidationException(String message) {
        super(message);
    }
}
