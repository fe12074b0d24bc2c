package dev.shelfscan.inventory.categorization;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import java.util.ArrayList;
import java.util.List;

/**
 * Used when no AI model is configured: products the keyword rules miss stay unclassified.
 */
public class DisabledCategorySuggester implements CategorySuggester {

    @Override
    public List<List<AiCategorySuggestion>> suggestBatch(List<ProductInput> products, List<Category> categories,
        List<Subcategory> subcategories) {
        List<List<AiCategorySuggestion>> result = new ArrayList<>();
        for (int i = 0; i < products.size(); i++) {
            result.add(List.of());
        }
        return result;
    }

    @Override
    public List<AiCategorySuggestion> suggest(ProductInput product, List<Category> categories,
        List<Subcategory> subcategories) {
        return List.of();
    }
}
