package dev.shelfscan.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * Result of matching one product against the known categories. Both parts are {@code null} when the
 * product is unclassified.
 */
public record CategoryMatch(CategorySuggestion category, SubcategorySuggestion subcategory) {

    private static final CategoryMatch UNCLASSIFIED = new CategoryMatch(null, null);

    public CategoryMatch {
        if (category == null && subcategory != null) {
            throw new IllegalArgumentException("A subcategory suggestion requires a category suggestion");
        }
        if (category != null && subcategory != null && subcategory.subcategory() != null
            && !Objects.equals(subcategory.subcategory().categoryId(), category.category().id())) {
            throw new IllegalArgumentException("Subcategory '" + subcategory.subcategory().name()
                + "' does not belong to category '" + category.category().name() + "'");
        }
    }

    public static CategoryMatch unclassified() {
        return UNCLASSIFIED;
    }

    @JsonIgnore
    public boolean isClassified() {
        return category != null;
    }
}
