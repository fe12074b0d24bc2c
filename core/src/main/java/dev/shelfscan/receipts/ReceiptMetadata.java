package dev.shelfscan.receipts;

import java.math.BigDecimal;

/**
 * Receipt level values found while scanning lines. All fields except {@code formatType} are optional.
 */
public record ReceiptMetadata(
    String merchantName,
    String invoiceNumber,
    String date,
    BigDecimal totalAmount,
    ReceiptFormatType formatType
) {

    public ReceiptMetadata {
        formatType = formatType == null ? ReceiptFormatType.UNKNOWN : formatType;
    }

    public static ReceiptMetadata empty() {
        return new ReceiptMetadata(null, null, null, null, ReceiptFormatType.UNKNOWN);
    }
}
