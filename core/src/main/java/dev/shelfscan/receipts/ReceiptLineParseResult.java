package dev.shelfscan.receipts;

import java.util.List;

public record ReceiptLineParseResult(List<ExtractedCandidate> candidates, ReceiptMetadata metadata) {

    public ReceiptLineParseResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        metadata = metadata == null ? ReceiptMetadata.empty() : metadata;
    }
}
