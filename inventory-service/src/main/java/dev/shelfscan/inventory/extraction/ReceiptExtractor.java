package dev.shelfscan.inventory.extraction;

/**
 * OCR or AI collaborator turning a receipt image into lines or structured candidates.
 */
public interface ReceiptExtractor {

    /**
     * @throws ReceiptExtractionException when the collaborator fails or returns unusable output
     */
    ReceiptExtraction extract(ReceiptImage image);
}
