package dev.shelfscan.receipts;

import java.math.BigDecimal;

/**
 * Scored product candidate. {@code needsReview} always reflects {@code confidence.overall} against the
 * review threshold of the scorer that produced it.
 */
public record ExtractedCandidate(
    String name,
    BigDecimal price,
    BigDecimal quantity,
    String unit,
    String brand,
    FieldConfidence confidence,
    boolean needsReview,
    String originalText
) {
}
