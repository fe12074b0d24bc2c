package dev.shelfscan.inventory.categorization;

import dev.shelfscan.inventory.ExternalServiceException;

public class CategorizationException extends ExternalServiceException {

    public CategorizationException(String message) {
        super(message);
    }

    public CategorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
