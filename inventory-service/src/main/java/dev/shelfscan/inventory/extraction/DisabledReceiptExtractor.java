package dev.shelfscan.inventory.extraction;

/**
 * Extractor used when no AI model is configured.
 */
public class DisabledReceiptExtractor implements ReceiptExtractor {

    @Override
    public ReceiptExtraction extract(ReceiptImage image) {
        throw new ReceiptExtractionException("AI extraction is disabled");
    }
}
