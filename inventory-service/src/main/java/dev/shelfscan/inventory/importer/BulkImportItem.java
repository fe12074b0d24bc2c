package dev.shelfscan.inventory.importer;

import dev.shelfscan.catalog.DuplicateVerdict;
import java.math.BigDecimal;

/**
 * One product to import. {@code duplicate} is the verdict from the duplicate check, if one was run;
 * a flagged duplicate is only imported when {@code duplicateConfirmed} is set.
 */
public record BulkImportItem(
    String sellerId,
    String name,
    BigDecimal price,
    Integer minOrderQuantity,
    String unit,
    String brand,
    String categoryId,
    String subcategoryId,
    DuplicateVerdict duplicate,
    boolean duplicateConfirmed
) {

    public BulkImportItem withDuplicate(DuplicateVerdict verdict) {
        return new BulkImportItem(sellerId, name, price, minOrderQuantity, unit, brand, categoryId, subcategoryId,
            verdict, duplicateConfirmed);
    }

    String label() {
        return name == null ? "" : name;
    }
}
