package dev.shelfscan.receipts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    void keepsExplicitHints() {
        CandidateDraft draft = CandidateDraft.builder()
            .name("Milk")
            .price(new BigDecimal("100.00"))
            .quantity(new BigDecimal("2"))
            .hints(new ConfidenceHints(0.9, 0.9, 0.9, null, 0.9))
            .build();

        ExtractedCandidate candidate = scorer.score(draft);

        assertThat(candidate.confidence()).isEqualTo(new FieldConfidence(0.9, 0.9, 0.9, 0.0, 0.9));
        assertThat(candidate.needsReview()).isFalse();
    }

    @Test
    void unobservedFieldsScoreZeroAndPullOverallDown() {
        CandidateDraft draft = CandidateDraft.builder()
            .name("Bread")
            .price(new BigDecimal("40"))
            .build();

        ExtractedCandidate candidate = scorer.score(draft);

        assertThat(candidate.confidence().quantity()).isZero();
        assertThat(candidate.confidence().brand()).isZero();
        assertThat(candidate.confidence().overall()).isCloseTo(0.52, within(1e-9));
        assertThat(candidate.needsReview()).isTrue();
        assertThat(candidate.quantity()).isEqualByComparingTo(BigDecimal.ONE);
    }

    @Test
    void observedFieldsWithoutHintsUseDefault() {
        CandidateDraft draft = CandidateDraft.builder()
            .name("Surf Excel")
            .brand("Surf")
            .price(new BigDecimal("120"))
            .quantity(BigDecimal.ONE)
            .build();

        ExtractedCandidate candidate = scorer.score(draft);

        assertThat(candidate.confidence().overall()).isCloseTo(0.8, within(1e-9));
        assertThat(candidate.needsReview()).isFalse();
    }

    @Test
    void clampsOutOfRangeHints() {
        CandidateDraft draft = CandidateDraft.builder()
            .name("Tea")
            .hints(new ConfidenceHints(-0.2, 1.4, null, null, 1.5))
            .build();

        ExtractedCandidate candidate = scorer.score(draft);

        assertThat(candidate.confidence().name()).isZero();
        assertThat(candidate.confidence().price()).isEqualTo(1.0);
        assertThat(candidate.confidence().overall()).isEqualTo(1.0);
        assertThat(candidate.price()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void overallStaysBoundedAndDrivesReviewFlag() {
        Double[] values = {null, -1.0, 0.0, 0.3, 0.69, 0.7, 0.71, 1.0, 2.0};
        for (Double nameHint : values) {
            for (Double overallHint : values) {
                CandidateDraft draft = CandidateDraft.builder()
                    .name("Item")
                    .price(BigDecimal.TEN)
                    .hints(new ConfidenceHints(nameHint, 0.5, null, null, overallHint))
                    .build();

                ExtractedCandidate candidate = scorer.score(draft);
                double overall = candidate.confidence().overall();

                assertThat(overall).isBetween(0.0, 1.0);
                assertThat(candidate.needsReview()).isEqualTo(overall < 0.7);
            }
        }
    }

    @Test
    void honoursConfiguredThreshold() {
        ConfidenceScorer strict = new ConfidenceScorer(0.9);
        CandidateDraft draft = CandidateDraft.builder()
            .name("Tea")
            .hints(new ConfidenceHints(null, null, null, null, 0.85))
            .build();

        assertThat(strict.score(draft).needsReview()).isTrue();
        assertThat(scorer.score(draft).needsReview()).isFalse();
    }

    @Test
    void rejectsInvalidThreshold() {
        assertThatThrownBy(() -> new ConfidenceScorer(1.2)).isInstanceOf(IllegalArgumentException.class);
    }
}
