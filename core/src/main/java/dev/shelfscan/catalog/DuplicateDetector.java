package dev.shelfscan.catalog;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags candidates whose name matches a product already in the seller's catalog, exactly or
 * approximately. Approximate matching uses substring containment or word overlap only, which keeps the
 * check linear in the catalog size.
 */
public class DuplicateDetector {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;
    static final int MIN_FUZZY_LENGTH = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final double similarityThreshold;

    public DuplicateDetector() {
        this(DEFAULT_SIMILARITY_THRESHOLD);
    }

    public DuplicateDetector(double similarityThreshold) {
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException(
                "Similarity threshold must be within (0, 1] but was " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    public DuplicateVerdict check(String candidateName, List<ExistingProduct> existingProducts) {
        if (candidateName == null) {
            throw new IllegalArgumentException("Product name must not be null");
        }
        Objects.requireNonNull(existingProducts, "existingProducts");

        String normalized = normalize(candidateName);
        if (normalized.isEmpty()) {
            return DuplicateVerdict.notDuplicate();
        }

        for (ExistingProduct product : existingProducts) {
            if (product != null && normalized.equals(normalize(product.name()))) {
                return DuplicateVerdict.exact(product);
            }
        }

        if (normalized.length() <= MIN_FUZZY_LENGTH) {
            return DuplicateVerdict.notDuplicate();
        }

        for (ExistingProduct product : existingProducts) {
            if (product == null) {
                continue;
            }
            String existing = normalize(product.name());
            if (existing.length() <= MIN_FUZZY_LENGTH) {
                continue;
            }
            if (similarity(normalized, existing) > similarityThreshold) {
                return DuplicateVerdict.similar(candidateName.trim(), product);
            }
        }
        return DuplicateVerdict.notDuplicate();
    }

    /**
     * Containment ratio when one name contains the other, otherwise the share of distinct words the two
     * names have in common relative to the longer word list.
     */
    static double similarity(String first, String second) {
        if (first.equals(second)) {
            return 1.0;
        }
        String shorter = first.length() <= second.length() ? first : second;
        String longer = shorter == first ? second : first;
        if (longer.contains(shorter)) {
            return (double) shorter.length() / longer.length();
        }

        Set<String> firstWords = words(first);
        Set<String> secondWords = words(second);
        int maxWords = Math.max(firstWords.size(), secondWords.size());
        if (maxWords == 0) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(firstWords);
        common.retainAll(secondWords);
        return (double) common.size() / maxWords;
    }

    private static Set<String> words(String value) {
        Set<String> words = new HashSet<>();
        for (String word : WHITESPACE.split(value)) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
