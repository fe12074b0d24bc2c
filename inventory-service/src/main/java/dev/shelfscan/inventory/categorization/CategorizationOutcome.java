package dev.shelfscan.inventory.categorization;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import java.util.List;

/**
 * Result of categorizing one batch. {@code subcategories} already includes {@code newSubcategoriesCreated}.
 */
public record CategorizationOutcome(
    List<CategorizedProduct> products,
    List<Category> categories,
    List<Subcategory> subcategories,
    List<Subcategory> newSubcategoriesCreated
) {

    public CategorizationOutcome {
        products = List.copyOf(products);
        categories = List.copyOf(categories);
        subcategories = List.copyOf(subcategories);
        newSubcategoriesCreated = List.copyOf(newSubcategoriesCreated);
    }
}
