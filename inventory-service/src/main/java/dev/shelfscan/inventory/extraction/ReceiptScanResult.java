package dev.shelfscan.inventory.extraction;

import dev.shelfscan.receipts.ExtractedCandidate;
import dev.shelfscan.receipts.ReceiptMetadata;
import java.util.List;

public record ReceiptScanResult(
    boolean success,
    List<ExtractedCandidate> products,
    ReceiptMetadata metadata,
    String error
) {

    public ReceiptScanResult {
        products = products == null ? List.of() : List.copyOf(products);
    }

    public static ReceiptScanResult success(List<ExtractedCandidate> products, ReceiptMetadata metadata) {
        return new ReceiptScanResult(true, products, metadata, null);
    }

    public static ReceiptScanResult failure(String error) {
        return new ReceiptScanResult(false, List.of(), null, error);
    }
}
