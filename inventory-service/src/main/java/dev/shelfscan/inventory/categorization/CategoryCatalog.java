package dev.shelfscan.inventory.categorization;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import java.util.List;

public record CategoryCatalog(List<Category> categories, List<Subcategory> subcategories) {

    public CategoryCatalog {
        categories = List.copyOf(categories);
        subcategories = List.copyOf(subcategories);
    }
}
