package dev.shelfscan.inventory.extraction;

import dev.shelfscan.receipts.CandidateDraft;
import dev.shelfscan.receipts.ReceiptMetadata;
import java.util.List;

/**
 * Output of an extraction collaborator: either raw text lines for the line parser, or candidates the
 * extractor already structured itself together with receipt metadata.
 */
public record ReceiptExtraction(List<String> lines, List<CandidateDraft> candidates, ReceiptMetadata metadata) {

    public ReceiptExtraction {
        if ((lines == null) == (candidates == null)) {
            throw new IllegalArgumentException("Exactly one of lines or candidates must be provided");
        }
        lines = lines == null ? null : List.copyOf(lines);
        candidates = candidates == null ? null : List.copyOf(candidates);
        metadata = metadata == null ? ReceiptMetadata.empty() : metadata;
    }

    public static ReceiptExtraction ofLines(List<String> lines) {
        return new ReceiptExtraction(lines, null, null);
    }

    public static ReceiptExtraction ofCandidates(List<CandidateDraft> candidates, ReceiptMetadata metadata) {
        return new ReceiptExtraction(null, candidates, metadata);
    }

    public boolean hasLines() {
        return lines != null;
    }
}
