package dev.shelfscan.inventory.categorization;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import java.util.List;

/**
 * External categorizer consulted for products the keyword rules could not place.
 */
public interface CategorySuggester {

    /**
     * Suggests categories for several products in one call. The result holds one (possibly empty) list
     * per product, in input order. The call succeeds or fails as a whole.
     *
     * @throws CategorizationException when the categorizer fails or answers with an unusable result
     */
    List<List<AiCategorySuggestion>> suggestBatch(List<ProductInput> products, List<Category> categories,
        List<Subcategory> subcategories);

    /**
     * @throws CategorizationException when the categorizer fails
     */
    List<AiCategorySuggestion> suggest(ProductInput product, List<Category> categories,
        List<Subcategory> subcategories);
}
