package dev.shelfscan.catalog;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps a lower-case keyword to a category name and the canonical subcategory label to propose when
 * the category has no matching subcategory yet.
 */
public record CategoryKeywordRule(String keyword, String categoryName, String subcategoryLabel, double confidence) {

    public CategoryKeywordRule {
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(categoryName, "categoryName");
        keyword = keyword.trim().toLowerCase(Locale.ROOT);
        if (keyword.isEmpty()) {
            throw new IllegalArgumentException("Keyword must not be blank");
        }
    }
}
