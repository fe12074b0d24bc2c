package dev.shelfscan.catalog;

import java.math.BigDecimal;

/**
 * Product already present in a seller's catalog, as needed for duplicate checks.
 */
public record ExistingProduct(String id, String name, BigDecimal price) {
}
