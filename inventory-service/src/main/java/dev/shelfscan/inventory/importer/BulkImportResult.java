package dev.shelfscan.inventory.importer;

import java.util.List;

/**
 * Aggregate outcome of a bulk import. Every submitted item is counted exactly once, as successful or
 * failed, and every failure has one error entry.
 */
public record BulkImportResult(int successful, int failed, List<ImportError> errors, List<String> createdProductIds) {

    public BulkImportResult {
        errors = List.copyOf(errors);
        createdProductIds = List.copyOf(createdProductIds);
        if (errors.size() != failed) {
            throw new IllegalStateException("Expected " + failed + " errors but got " + errors.size());
        }
        if (createdProductIds.size() != successful) {
            throw new IllegalStateException("Expected " + successful + " created ids but got " + createdProductIds.size());
        }
    }

    public int total() {
        return successful + failed;
    }
}
