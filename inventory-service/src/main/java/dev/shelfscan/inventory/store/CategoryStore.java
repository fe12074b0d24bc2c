package dev.shelfscan.inventory.store;

import dev.shelfscan.catalog.Category;
import dev.shelfscan.catalog.Subcategory;
import java.util.List;
import java.util.Optional;

/**
 * Category and subcategory persistence. Only {@link #createSubcategory(String, String)} mutates the store.
 */
public interface CategoryStore {

    List<Category> listCategories();

    List<Subcategory> listSubcategories();

    /**
     * Creates a subcategory under the given category. The slug is derived from the name and made unique.
     */
    Subcategory createSubcategory(String name, String categoryId);

    default Optional<Category> findCategory(String idOrName) {
        if (idOrName == null || idOrName.isBlank()) {
            return Optional.empty();
        }
        String wanted = idOrName.trim();
        List<Category> categories = listCategories();
        return categories.stream()
            .filter(category -> wanted.equals(category.id()))
            .findFirst()
            .or(() -> categories.stream()
                .filter(category -> category.name() != null && category.name().equalsIgnoreCase(wanted))
                .findFirst());
    }

    default Optional<Subcategory> findSubcategory(String categoryId, String idOrName) {
        if (idOrName == null || idOrName.isBlank()) {
            return Optional.empty();
        }
        String wanted = idOrName.trim();
        List<Subcategory> candidates = listSubcategories().stream()
            .filter(subcategory -> categoryId.equals(subcategory.categoryId()))
            .toList();
        return candidates.stream()
            .filter(subcategory -> wanted.equals(subcategory.id()))
            .findFirst()
            .or(() -> candidates.stream()
                .filter(subcategory -> subcategory.name() != null && subcategory.name().equalsIgnoreCase(wanted))
                .findFirst());
    }
}
