package dev.shelfscan.receipts;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Normalises the confidence of extracted candidates and derives the review flag.
 *
 * <p>Explicit hints are kept as reported (clamped to {@code [0, 1]}). A field that was observed but
 * carries no hint receives {@link #DEFAULT_OBSERVED_CONFIDENCE}; a field that was not observed scores 0.
 * The overall value is the reported overall hint when present, otherwise the weighted mean of the
 * four field scores.</p>
 */
public class ConfidenceScorer {

    public static final double DEFAULT_REVIEW_THRESHOLD = 0.7;
    public static final double DEFAULT_OBSERVED_CONFIDENCE = 0.8;

    static final double NAME_WEIGHT = 0.35;
    static final double PRICE_WEIGHT = 0.30;
    static final double QUANTITY_WEIGHT = 0.20;
    static final double BRAND_WEIGHT = 0.15;

    private final double reviewThreshold;

    public ConfidenceScorer() {
        this(DEFAULT_REVIEW_THRESHOLD);
    }

    public ConfidenceScorer(double reviewThreshold) {
        if (reviewThreshold < 0.0 || reviewThreshold > 1.0) {
            throw new IllegalArgumentException("Review threshold must be within [0, 1] but was " + reviewThreshold);
        }
        this.reviewThreshold = reviewThreshold;
    }

    public double reviewThreshold() {
        return reviewThreshold;
    }

    public ExtractedCandidate score(CandidateDraft draft) {
        Objects.requireNonNull(draft, "draft");
        ConfidenceHints hints = draft.hints();

        String name = draft.name() == null ? "" : draft.name().trim();
        String brand = hasText(draft.brand()) ? draft.brand().trim() : null;

        double nameScore = fieldScore(hints.name(), !name.isEmpty());
        double priceScore = fieldScore(hints.price(), draft.price() != null);
        double quantityScore = fieldScore(hints.quantity(), draft.quantity() != null);
        double brandScore = fieldScore(hints.brand(), brand != null);

        double overall = hints.overall() != null
            ? FieldConfidence.clamp(hints.overall())
            : weightedMean(nameScore, priceScore, quantityScore, brandScore);

        FieldConfidence confidence = new FieldConfidence(nameScore, priceScore, quantityScore, brandScore, overall);

        return new ExtractedCandidate(
            name,
            draft.price() == null ? BigDecimal.ZERO : draft.price(),
            draft.quantity() == null ? BigDecimal.ONE : draft.quantity(),
            hasText(draft.unit()) ? draft.unit().trim() : null,
            brand,
            confidence,
            confidence.overall() < reviewThreshold,
            draft.originalText());
    }

    static double weightedMean(double name, double price, double quantity, double brand) {
        double mean = name * NAME_WEIGHT
            + price * PRICE_WEIGHT
            + quantity * QUANTITY_WEIGHT
            + brand * BRAND_WEIGHT;
        return FieldConfidence.clamp(mean);
    }

    private static double fieldScore(Double hint, boolean observed) {
        if (hint != null) {
            return FieldConfidence.clamp(hint);
        }
        return observed ? DEFAULT_OBSERVED_CONFIDENCE : 0.0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
