package dev.shelfscan.inventory.categorization;

import dev.shelfscan.catalog.CategorySuggestion;
import dev.shelfscan.catalog.SubcategorySuggestion;
import dev.shelfscan.receipts.ExtractedCandidate;

public record CategorizedProduct(
    ExtractedCandidate product,
    CategorySuggestion category,
    SubcategorySuggestion subcategory,
    CategorizationSource source
) {
}
