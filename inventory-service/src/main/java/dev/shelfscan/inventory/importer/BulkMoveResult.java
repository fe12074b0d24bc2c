package dev.shelfscan.inventory.importer;

import java.util.List;

public record BulkMoveResult(
    boolean success,
    int movedCount,
    List<FailedProduct> failedProducts,
    String categoryId,
    String subcategoryId
) {

    public BulkMoveResult {
        failedProducts = List.copyOf(failedProducts);
    }
}
