package dev.shelfscan.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Suggested category. Category suggestions always refer to an existing category.
 */
public record CategorySuggestion(Category category, double confidence) {

    public CategorySuggestion {
        Objects.requireNonNull(category, "category");
    }

    @JsonProperty("isNew")
    public boolean isNew() {
        return false;
    }
}
