package dev.shelfscan.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Suggested subcategory. When {@code isNew} is set no existing subcategory matched and
 * {@code suggestedName} carries the proposed name; {@code subcategory} stays {@code null} until created.
 */
public record SubcategorySuggestion(
    Subcategory subcategory,
    String suggestedName,
    double confidence,
    @JsonProperty("isNew") boolean isNew
) {

    public SubcategorySuggestion {
        if (isNew && subcategory != null) {
            throw new IllegalArgumentException("A new subcategory suggestion cannot reference an existing subcategory");
        }
        if (!isNew && subcategory == null) {
            throw new IllegalArgumentException("An existing subcategory suggestion requires a subcategory");
        }
    }

    public static SubcategorySuggestion existing(Subcategory subcategory, double confidence) {
        return new SubcategorySuggestion(subcategory, subcategory.name(), confidence, false);
    }

    public static SubcategorySuggestion proposed(String suggestedName, double confidence) {
        return new SubcategorySuggestion(null, suggestedName, confidence, true);
    }
}
