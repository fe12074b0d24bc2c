package dev.shelfscan.receipts;

/**
 * Raw confidence values reported by an extractor. Any component may be {@code null} when the
 * extractor did not report it.
 */
public record ConfidenceHints(
    Double name,
    Double price,
    Double quantity,
    Double brand,
    Double overall
) {

    private static final ConfidenceHints NONE = new ConfidenceHints(null, null, null, null, null);

    public static ConfidenceHints none() {
        return NONE;
    }

    public boolean isEmpty() {
        return name == null && price == null && quantity == null && brand == null && overall == null;
    }
}
