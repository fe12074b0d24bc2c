package dev.shelfscan.receipts;

import java.math.BigDecimal;

/**
 * Unscored product candidate as produced by the line parser or an external extractor. Fields that
 * were not observed are {@code null}.
 */
public record CandidateDraft(
    String name,
    BigDecimal price,
    BigDecimal quantity,
    String unit,
    String brand,
    ConfidenceHints hints,
    String originalText
) {

    public CandidateDraft {
        hints = hints == null ? ConfidenceHints.none() : hints;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String name;
        private BigDecimal price;
        private BigDecimal quantity;
        private String unit;
        private String brand;
        private ConfidenceHints hints;
        private String originalText;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder hints(ConfidenceHints hints) {
            this.hints = hints;
            return this;
        }

        public Builder originalText(String originalText) {
            this.originalText = originalText;
            return this;
        }

        public CandidateDraft build() {
            return new CandidateDraft(name, price, quantity, unit, brand, hints, originalText);
        }
    }
}
