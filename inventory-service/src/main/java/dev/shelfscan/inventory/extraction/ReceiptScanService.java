package dev.shelfscan.inventory.extraction;

import dev.shelfscan.inventory.ExternalServiceException;
import dev.shelfscan.receipts.CandidateDraft;
import dev.shelfscan.receipts.ConfidenceScorer;
import dev.shelfscan.receipts.ExtractedCandidate;
import dev.shelfscan.receipts.ReceiptLineParseResult;
import dev.shelfscan.receipts.ReceiptLineParser;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a receipt image through validation, extraction and scoring.
 *
 * <p>Invalid payloads are rejected with an {@link dev.shelfscan.inventory.InputValidationException}.
 * Extraction failures are reported as an unsuccessful result carrying the collaborator's message; a
 * malformed extraction is never partially used.</p>
 */
public class ReceiptScanService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptScanService.class);

    private final ReceiptImageValidator imageValidator;
    private final ReceiptExtractor extractor;
    private final ReceiptLineParser lineParser;
    private final ConfidenceScorer scorer;

    public ReceiptScanService(ReceiptImageValidator imageValidator, ReceiptExtractor extractor,
        ReceiptLineParser lineParser, ConfidenceScorer scorer) {
        this.imageValidator = Objects.requireNonNull(imageValidator, "imageValidator");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.lineParser = Objects.requireNonNull(lineParser, "lineParser");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public ReceiptScanResult scan(String imagePayload) {
        ReceiptImage image = imageValidator.decode(imagePayload);
        LOGGER.info("Scanning {} receipt image of {} bytes", image.format(), image.size());

        ReceiptExtraction extraction;
        try {
            extraction = extractor.extract(image);
        } catch (ExternalServiceException ex) {
            LOGGER.warn("Receipt extraction failed: {}", ex.getMessage());
            return ReceiptScanResult.failure(ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected error during receipt extraction", ex);
            return ReceiptScanResult.failure("Receipt extraction failed: " + ex.getMessage());
        }

        if (extraction.hasLines()) {
            ReceiptLineParseResult parsed = lineParser.parse(extraction.lines());
            LOGGER.info("Parsed {} receipt lines into {} products", extraction.lines().size(),
                parsed.candidates().size());
            return ReceiptScanResult.success(parsed.candidates(), parsed.metadata());
        }

        List<ExtractedCandidate> products = scoreCandidates(extraction.candidates());
        LOGGER.info("Scored {} extracted products ({} flagged for review)", products.size(),
            products.stream().filter(ExtractedCandidate::needsReview).count());
        return ReceiptScanResult.success(products, extraction.metadata());
    }

    private List<ExtractedCandidate> scoreCandidates(List<CandidateDraft> drafts) {
        List<ExtractedCandidate> products = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();
        for (CandidateDraft draft : drafts) {
            ExtractedCandidate candidate = scorer.score(draft);
            if (candidate.name().isEmpty()) {
                LOGGER.debug("Dropping extracted product without a name: {}", draft.originalText());
                continue;
            }
            if (!seenNames.add(candidate.name().toLowerCase(Locale.ROOT))) {
                continue;
            }
            products.add(candidate);
        }
        return products;
    }
}
