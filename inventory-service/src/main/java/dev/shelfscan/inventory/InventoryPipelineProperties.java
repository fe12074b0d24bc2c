package dev.shelfscan.inventory;

import dev.shelfscan.catalog.DuplicateDetector;
import dev.shelfscan.receipts.ConfidenceScorer;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds and limits used by the receipt to inventory pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "inventory.pipeline")
public class InventoryPipelineProperties {

    public static final long DEFAULT_MAX_IMAGE_BYTES = 10L * 1024 * 1024;

    /**
     * Candidates whose overall confidence falls below this value are flagged for review.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double reviewThreshold = ConfidenceScorer.DEFAULT_REVIEW_THRESHOLD;

    /**
     * Similarity above which two product names are reported as duplicates.
     */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double duplicateSimilarityThreshold = DuplicateDetector.DEFAULT_SIMILARITY_THRESHOLD;

    /**
     * Minimum confidence for creating a suggested subcategory automatically.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double subcategoryCreationThreshold = 0.7;

    /**
     * Largest accepted receipt image after base64 decoding.
     */
    @Min(1)
    private long maxImageBytes = DEFAULT_MAX_IMAGE_BYTES;

    /**
     * Number of products written concurrently during a bulk import. 1 imports sequentially.
     */
    @Min(1)
    private int importParallelism = 1;

    /**
     * Categories the in-memory category store starts with when Firestore is disabled.
     */
    private List<String> seedCategories = new ArrayList<>(List.of("Food", "Dairy", "Personal Care", "Home Care",
        "Hardware", "Beverages", "Electronics", "Stationery"));

    public double getReviewThreshold() {
        return reviewThreshold;
    }

    public void setReviewThreshold(double reviewThreshold) {
        this.reviewThreshold = reviewThreshold;
    }

    public double getDuplicateSimilarityThreshold() {
        return duplicateSimilarityThreshold;
    }

    public void setDuplicateSimilarityThreshold(double duplicateSimilarityThreshold) {
        this.duplicateSimilarityThreshold = duplicateSimilarityThreshold;
    }

    public double getSubcategoryCreationThreshold() {
        return subcategoryCreationThreshold;
    }

    public void setSubcategoryCreationThreshold(double subcategoryCreationThreshold) {
        this.subcategoryCreationThreshold = subcategoryCreationThreshold;
    }

    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(long maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }

    public int getImportParallelism() {
        return importParallelism;
    }

    public void setImportParallelism(int importParallelism) {
        this.importParallelism = importParallelism;
    }

    public List<String> getSeedCategories() {
        return seedCategories;
    }

    public void setSeedCategories(List<String> seedCategories) {
        this.seedCategories = seedCategories;
    }
}
