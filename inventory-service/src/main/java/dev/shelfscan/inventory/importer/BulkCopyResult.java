package dev.shelfscan.inventory.importer;

import dev.shelfscan.inventory.store.StoredProduct;
import java.util.List;

public record BulkCopyResult(
    boolean success,
    int copiedCount,
    List<StoredProduct> copiedProducts,
    List<FailedProduct> failedProducts
) {

    public BulkCopyResult {
        copiedProducts = List.copyOf(copiedProducts);
        failedProducts = List.copyOf(failedProducts);
    }
}
