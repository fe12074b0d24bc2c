package dev.shelfscan.inventory.extraction;

import dev.shelfscan.inventory.ExternalServiceException;

public class ReceiptExtractionException extends ExternalServiceException {

    public ReceiptExtractionException(String message) {
        super(message);
    }

    public ReceiptExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
