package dev.shelfscan.inventory.extraction;

/**
 * Decoded and validated receipt image.
 */
public record ReceiptImage(byte[] bytes, ImageFormat format) {

    public int size() {
        return bytes.length;
    }
}
