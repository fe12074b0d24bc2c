package dev.shelfscan.inventory.store;

import dev.shelfscan.inventory.ExternalServiceException;

/**
 * Raised when the backing document store cannot complete a read or write.
 */
public class CatalogStoreException extends ExternalServiceException {

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
