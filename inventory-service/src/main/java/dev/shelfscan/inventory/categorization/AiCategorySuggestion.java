package dev.shelfscan.inventory.categorization;

/**
 * One ranked category guess returned by an AI categorizer. Names refer to categories and subcategories
 * by display name; the subcategory may be one that does not exist yet.
 */
public record AiCategorySuggestion(
    String categoryName,
    double confidence,
    String subcategoryName,
    Double subcategoryConfidence
) {
}
