package dev.shelfscan.receipts;

/**
 * Per-field reliability estimates for a candidate, each in {@code [0, 1]}.
 */
public record FieldConfidence(
    double name,
    double price,
    double quantity,
    double brand,
    double overall
) {

    public FieldConfidence {
        name = clamp(name);
        price = clamp(price);
        quantity = clamp(quantity);
        brand = clamp(brand);
        overall = clamp(overall);
    }

    static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
